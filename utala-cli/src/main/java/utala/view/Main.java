/*
 * utala: kaos 9
 * Copyright (C) 2026  utala developers
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package utala.view;

import io.sentry.Sentry;
import picocli.CommandLine;
import utala.cli.ExitCode;
import utala.cli.UtalaCli;

/**
 * Entry point of the utala command line.
 */
public final class Main {

    public static void main(final String[] args) {
        // Error reporting stays off unless sentry.properties or SENTRY_DSN supplies a DSN.
        Sentry.init(options -> {
            options.setEnableExternalConfiguration(true);
            options.setRelease(UtalaCli.getVersionString());
            options.setEnvironment(System.getProperty("os.name"));
            options.setTag("Java Version", System.getProperty("java.version"));
            options.setShutdownTimeoutMillis(5000);
        }, true);

        System.exit(createCommandLine().execute(args));
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new UtalaCli())
            .setExecutionExceptionHandler(new ExecutionExceptionHandler())
            .setParameterExceptionHandler(new ParameterExceptionHandler());
    }

    /**
     * Runtime errors inside a command.
     */
    private static class ExecutionExceptionHandler implements CommandLine.IExecutionExceptionHandler {
        @Override
        public int handleExecutionException(Exception ex, CommandLine cmd,
                CommandLine.ParseResult parseResult) {
            System.err.println("Error: " + ex.getMessage());
            if (System.getProperty("utala.debug") != null) {
                ex.printStackTrace(System.err);
            }
            Sentry.captureException(ex);
            return ExitCode.RUNTIME_ERROR;
        }
    }

    /**
     * Invalid arguments.
     */
    private static class ParameterExceptionHandler implements CommandLine.IParameterExceptionHandler {
        @Override
        public int handleParseException(CommandLine.ParameterException ex, String[] args) {
            CommandLine cmd = ex.getCommandLine();
            System.err.println("Error: " + ex.getMessage());
            System.err.println();
            cmd.usage(System.err);
            return ExitCode.ARGS_ERROR;
        }
    }

    private Main() {
    }
}
