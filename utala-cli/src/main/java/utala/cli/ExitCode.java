package utala.cli;

/**
 * Exit status of the utala command line.
 */
public final class ExitCode {
    /** Successful execution */
    public static final int SUCCESS = 0;

    /** Invalid arguments or usage error */
    public static final int ARGS_ERROR = 1;

    /** Replay could not be read, written or reproduced */
    public static final int REPLAY_ERROR = 2;

    /** Runtime/execution error */
    public static final int RUNTIME_ERROR = 3;

    private ExitCode() {
    }
}
