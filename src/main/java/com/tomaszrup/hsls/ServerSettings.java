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
package com.tomaszrup.hsls;

import com.tomaszrup.hsls.importers.CabalHelperBackend;

/**
 * Immutable server settings, built from the client's initialization options
 * by {@link InitializationOptionsParser}.
 */
public final class ServerSettings {

    public static final long DEFAULT_HELPER_TIMEOUT_SECONDS = 120;
    public static final long DEFAULT_REQUEST_TIMEOUT_SECONDS = 30;

    private final String helperCommand;
    private final long helperTimeoutSeconds;
    private final long requestTimeoutSeconds;
    private final boolean cradleCacheEnabled;

    public ServerSettings(String helperCommand, long helperTimeoutSeconds,
                          long requestTimeoutSeconds, boolean cradleCacheEnabled) {
        this.helperCommand = helperCommand;
        this.helperTimeoutSeconds = helperTimeoutSeconds;
        this.requestTimeoutSeconds = requestTimeoutSeconds;
        this.cradleCacheEnabled = cradleCacheEnabled;
    }

    public static ServerSettings defaults() {
        return new ServerSettings(CabalHelperBackend.DEFAULT_HELPER_COMMAND,
                DEFAULT_HELPER_TIMEOUT_SECONDS, DEFAULT_REQUEST_TIMEOUT_SECONDS, true);
    }

    /** Executable queried for package and unit metadata. */
    public String getHelperCommand() {
        return helperCommand;
    }

    public long getHelperTimeoutSeconds() {
        return helperTimeoutSeconds;
    }

    /** How long a caller waits for a module load before giving up. */
    public long getRequestTimeoutSeconds() {
        return requestTimeoutSeconds;
    }

    public boolean isCradleCacheEnabled() {
        return cradleCacheEnabled;
    }

    @Override
    public String toString() {
        return "ServerSettings{helperCommand=" + helperCommand
                + ", helperTimeoutSeconds=" + helperTimeoutSeconds
                + ", requestTimeoutSeconds=" + requestTimeoutSeconds
                + ", cradleCache=" + cradleCacheEnabled + "}";
    }
}
