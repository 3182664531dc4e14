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
package com.tomaszrup.hsls.cradle;

import java.util.Objects;

/**
 * Result of running a cradle action for one file.
 *
 * <ul>
 *   <li>{@link Status#SUCCESS}: flags are available</li>
 *   <li>{@link Status#FAILED}: the file belongs to the package but no
 *       component could be found for it</li>
 *   <li>{@link Status#NONE}: the cradle cannot compile anything</li>
 * </ul>
 */
public final class CradleLoadResult {

    public enum Status {
        SUCCESS,
        FAILED,
        NONE
    }

    private static final CradleLoadResult NONE = new CradleLoadResult(Status.NONE, null, null);

    private final Status status;
    private final ComponentOptions options;
    private final CradleError error;

    private CradleLoadResult(Status status, ComponentOptions options, CradleError error) {
        this.status = status;
        this.options = options;
        this.error = error;
    }

    public static CradleLoadResult success(ComponentOptions options) {
        return new CradleLoadResult(Status.SUCCESS, Objects.requireNonNull(options, "options"), null);
    }

    public static CradleLoadResult failed(CradleError error) {
        return new CradleLoadResult(Status.FAILED, null, Objects.requireNonNull(error, "error"));
    }

    public static CradleLoadResult none() {
        return NONE;
    }

    public Status getStatus() {
        return status;
    }

    public boolean isSuccess() {
        return status == Status.SUCCESS;
    }

    /** Flags for the file; {@code null} unless {@link #isSuccess()}. */
    public ComponentOptions getOptions() {
        return options;
    }

    /** Failure detail; {@code null} unless the status is {@link Status#FAILED}. */
    public CradleError getError() {
        return error;
    }

    @Override
    public String toString() {
        switch (status) {
            case SUCCESS:
                return "CradleLoadResult{SUCCESS, " + options + "}";
            case FAILED:
                return "CradleLoadResult{FAILED, " + error + "}";
            default:
                return "CradleLoadResult{NONE}";
        }
    }
}
