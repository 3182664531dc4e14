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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.InterruptedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs the metadata helper and captures its standard output. Output streams
 * are drained on daemon threads so a chatty helper cannot block on a full
 * pipe.
 */
class HelperProcessRunner {

    private static final Logger logger = LoggerFactory.getLogger(HelperProcessRunner.class);

    private final long timeoutSeconds;

    HelperProcessRunner(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    /**
     * @return the helper's standard output
     * @throws IOException if the process cannot be started, times out, or
     *                     exits with a non-zero code
     */
    String run(Path workingDir, List<String> command) throws IOException {
        logger.debug("Running helper: {} in {}", command, workingDir);
        ProcessBuilder pb = new ProcessBuilder(command)
                .directory(workingDir.toFile())
                .redirectErrorStream(false);

        Process process = pb.start();

        StreamGobbler stdoutGobbler = new StreamGobbler(process.getInputStream());
        StreamGobbler stderrGobbler = new StreamGobbler(process.getErrorStream());
        stdoutGobbler.start();
        stderrGobbler.start();

        try {
            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);
            if (!finished) {
                process.destroyForcibly();
                throw new IOException("Helper timed out after " + timeoutSeconds + " seconds: " + command);
            }
            stdoutGobbler.join(5000);
            stderrGobbler.join(5000);
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("Interrupted while running " + command);
            interrupted.initCause(e);
            throw interrupted;
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            String stderr = stderrGobbler.getOutput();
            if (!stderr.isEmpty()) {
                logger.warn("Helper stderr: {}", stderr);
            }
            throw new IOException("Helper exited with code " + exitCode + ": " + command);
        }
        return stdoutGobbler.getOutput();
    }

    private static class StreamGobbler extends Thread {
        private final InputStream inputStream;
        private final StringBuffer output = new StringBuffer();

        StreamGobbler(InputStream inputStream) {
            this.inputStream = inputStream;
            setDaemon(true);
            setName("hsls-helper-output");
        }

        @Override
        public void run() {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(inputStream, StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    output.append(line).append(System.lineSeparator());
                }
            } catch (IOException e) {
                logger.debug("Helper output stream closed: {}", e.getMessage());
            }
        }

        String getOutput() {
            return output.toString();
        }
    }
}
