////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.hsls.util;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Canonical form of a path: absolute, normalised and with symlinks resolved
 * as far as the filesystem allows. Two spellings of the same file map to the
 * same canonical path.
 */
public final class CanonicalPaths {

	private CanonicalPaths() {
	}

	/**
	 * Resolves symlinks when the file exists. For a file that does not exist
	 * (yet), the parent directory is resolved instead and the file name
	 * appended, so a file and its later-created self share one key.
	 */
	public static Path canonicalize(Path path) {
		if (path == null) {
			return null;
		}
		try {
			return path.toRealPath();
		} catch (IOException e) {
			Path absolute = path.toAbsolutePath().normalize();
			Path parent = absolute.getParent();
			Path fileName = absolute.getFileName();
			if (parent == null || fileName == null) {
				return absolute;
			}
			try {
				return parent.toRealPath().resolve(fileName);
			} catch (IOException parentMissing) {
				return absolute;
			}
		}
	}
}
