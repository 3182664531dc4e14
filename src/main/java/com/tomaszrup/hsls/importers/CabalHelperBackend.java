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
package com.tomaszrup.hsls.importers;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * {@link BuildToolBackend} that detects projects from marker files and
 * obtains package and unit metadata from an external helper executable
 * (by default {@code cabal-helper}).
 *
 * <p>Invocations:</p>
 * <pre>
 * &lt;helper&gt; --project-dir &lt;root&gt; --project-kind &lt;kind&gt; --dist-dir &lt;dist&gt; packages
 * &lt;helper&gt; --project-dir &lt;root&gt; --project-kind &lt;kind&gt; --dist-dir &lt;dist&gt; unit-info &lt;unit&gt;
 * </pre>
 *
 * <p>Both print JSON on stdout, see {@link HelperOutputParser}. The
 * {@code unit-info} call may configure the unit's dependencies and is
 * therefore slow.</p>
 */
public class CabalHelperBackend implements BuildToolBackend {

    private static final Logger logger = LoggerFactory.getLogger(CabalHelperBackend.class);

    public static final String DEFAULT_HELPER_COMMAND = "cabal-helper";

    private final String helperCommand;
    private final HelperProcessRunner runner;

    public CabalHelperBackend(String helperCommand, long timeoutSeconds) {
        this.helperCommand = helperCommand;
        this.runner = new HelperProcessRunner(timeoutSeconds);
    }

    public String getHelperCommand() {
        return helperCommand;
    }

    @Override
    public List<ProjectReference> findProjects(Path dir) {
        return ProjectMarkers.findProjects(dir);
    }

    @Override
    public List<CabalPackage> listPackages(ProjectReference project) throws IOException {
        List<String> command = baseCommand(project);
        command.add("packages");
        String output = runner.run(project.getRootDir(), command);
        List<CabalPackage> packages = HelperOutputParser.parsePackages(output, project);
        logger.info("Project {} has {} package(s)", project, packages.size());
        return packages;
    }

    @Override
    public UnitIntrospection introspectUnit(CabalUnit unit) {
        List<String> command = baseCommand(unit.getProject());
        command.add("unit-info");
        command.add(unit.getUnitId());
        try {
            String output = runner.run(unit.getProject().getRootDir(), command);
            return UnitIntrospection.success(unit, HelperOutputParser.parseUnitInfo(output, unit));
        } catch (IOException e) {
            return UnitIntrospection.failure(unit, e);
        }
    }

    List<String> baseCommand(ProjectReference project) {
        List<String> command = new ArrayList<>();
        command.add(helperCommand);
        command.add("--project-dir");
        command.add(project.getRootDir().toString());
        command.add("--project-kind");
        command.add(project.getDiscriminator());
        command.add("--dist-dir");
        command.add(project.getDistDir().toString());
        return command;
    }
}
