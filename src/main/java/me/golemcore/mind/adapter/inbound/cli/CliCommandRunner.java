/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.mind.adapter.inbound.cli;

import me.golemcore.mind.adapter.inbound.command.CommandRouter;
import me.golemcore.mind.port.inbound.CommandPort;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Runs one memory command from the command line and prints its output.
 *
 * <pre>
 * mind [--project=&lt;path&gt;] &lt;command&gt; [args...]
 * </pre>
 *
 * Without {@code --project} the working directory is the project. Without a
 * command nothing runs.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CliCommandRunner implements ApplicationRunner, ExitCodeGenerator {

    private static final String PROJECT_OPTION = "--project=";
    private static final String SPRING_OPTION = "--spring.";
    private static final String LOGGING_OPTION = "--logging.";
    private static final String MIND_OPTION = "--mind.";

    private final CommandPort commandPort;

    private int exitCode;

    @Override
    public void run(ApplicationArguments args) {
        exitCode = dispatch(Arrays.asList(args.getSourceArgs()), System.out, System.err);
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Parses raw arguments, runs the command and prints the result.
     *
     * @return process exit code: 0 on success or when no command is given, 1
     *         on failure
     */
    int dispatch(List<String> rawArgs, PrintStream out, PrintStream err) {
        String project = "";
        List<String> rest = new ArrayList<>();
        for (String arg : rawArgs) {
            if (arg.startsWith(PROJECT_OPTION)) {
                project = arg.substring(PROJECT_OPTION.length()).trim();
            } else if (arg.startsWith(SPRING_OPTION) || arg.startsWith(LOGGING_OPTION)
                    || arg.startsWith(MIND_OPTION)) {
                // consumed by Spring's environment
                continue;
            } else {
                rest.add(arg);
            }
        }
        if (rest.isEmpty()) {
            log.debug("[Cli] No command given");
            return 0;
        }

        String command = rest.get(0);
        List<String> commandArgs = rest.subList(1, rest.size());
        CommandPort.CommandResult result = commandPort.execute(command, commandArgs,
                Map.of(CommandRouter.CONTEXT_PROJECT, project));
        if (result.success()) {
            out.println(result.output());
            return 0;
        }
        err.println(result.output());
        return 1;
    }
}
