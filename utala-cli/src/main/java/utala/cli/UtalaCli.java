package utala.cli;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.IVersionProvider;

/**
 * Root command. Everything runs through a subcommand.
 */
@Command(
    name = "utala",
    description = "utala: kaos 9, a game of hidden units and dogfights",
    mixinStandardHelpOptions = true,
    versionProvider = UtalaCli.VersionProvider.class,
    subcommands = {
        CommandLine.HelpCommand.class,
        SimCommand.class,
        PlayCommand.class,
        ReplayCommand.class,
        ProfilesCommand.class
    }
)
public class UtalaCli implements Runnable {

    @Override
    public void run() {
        CommandLine.usage(this, System.out);
    }

    /**
     * @return the jar's implementation version, or "dev" when running from classes
     */
    public static String getVersionString() {
        String version = UtalaCli.class.getPackage().getImplementationVersion();
        return version == null ? "dev" : version;
    }

    public static class VersionProvider implements IVersionProvider {
        @Override
        public String[] getVersion() {
            return new String[] {
                "utala " + getVersionString(),
                "Java: " + System.getProperty("java.version"),
                "OS: " + System.getProperty("os.name") + " " + System.getProperty("os.version")
            };
        }
    }
}
