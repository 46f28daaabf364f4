package com.mimecast.wren;

import com.mimecast.wren.main.EnqueueCLI;
import com.mimecast.wren.main.Service;
import org.apache.commons.cli.CommandLine;
import org.apache.commons.cli.DefaultParser;
import org.apache.commons.cli.HelpFormatter;
import org.apache.commons.cli.Option;
import org.apache.commons.cli.Options;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.core.config.Configurator;

import javax.naming.ConfigurationException;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.util.Optional;

/**
 * Main runnable.
 *
 * <p>Runs the inbound worker by default.
 * <br>--enqueue pushes an eml file to the inbound queue instead.
 *
 * @see Service
 * @see EnqueueCLI
 */
public class Main {

    /**
     * Application jar name.
     */
    private static final String NAME = "wren.jar";

    /**
     * Application jar usage.
     */
    public static final String USAGE = "java -jar " + NAME;

    /**
     * Application description.
     */
    public static final String DESCRIPTION = "Inbound mail queue worker";

    /**
     * Default configuration directory.
     */
    public static final String DEFAULT_CONF = "cfg/";

    private final String[] args;
    private int exitCode = 0;

    /**
     * Main runnable.
     *
     * @param args String array.
     */
    public static void main(String[] args) {
        Main main = new Main(args);
        if (main.getExitCode() != 0) {
            System.exit(main.getExitCode());
        }
    }

    /**
     * Constructs a new Main instance.
     *
     * @param args String array.
     */
    Main(String[] args) {
        this.args = args;

        // Disable logging.
        Configurator.setAllLevels(LogManager.getRootLogger().getName(), Level.OFF);

        // Parse options.
        Optional<CommandLine> opt = parseArgs(options());

        if (opt.isPresent()) {
            CommandLine cmd = opt.get();

            // Show usage.
            if (cmd.hasOption("help")) {
                optionsUsage(options());
            }

            // Enqueue file.
            else if (cmd.hasOption("enqueue")) {
                exitCode = new EnqueueCLI(this).run(cmd);
            }

            // Run worker.
            else {
                Configurator.reconfigure();
                exitCode = runService(cmd.getOptionValue("conf", DEFAULT_CONF));
            }
        } else {
            exitCode = 2;
        }
    }

    /**
     * Runs the worker service.
     *
     * @param path Configuration directory.
     * @return Exit code.
     */
    private int runService(String path) {
        try {
            Service.run(path);
            return 0;
        } catch (ConfigurationException e) {
            log("Configuration error: " + e.getMessage());
            return 1;
        } catch (IOException e) {
            log("Unable to load configuration: " + e.getMessage());
            return 1;
        }
    }

    /**
     * CLI options.
     * <i>Listing order will be alphabetical</i>.
     *
     * @return Options instance.
     */
    private Options options() {
        Options options = new Options();
        options.addOption("c", "conf", true, "Path to configuration dir (Default: cfg/)");
        options.addOption(null, "enqueue", true, "Enqueue eml file and exit");
        options.addOption("m", "mail", true, "Envelope sender for --enqueue");
        options.addOption(Option.builder("r")
                .longOpt("rcpt")
                .hasArgs()
                .desc("Envelope recipients for --enqueue")
                .build());
        options.addOption("h", "help", false, "Show usage");
        return options;
    }

    /**
     * CLI usage.
     *
     * @param options Options instance.
     */
    public void optionsUsage(Options options) {
        log(USAGE);
        log(" " + DESCRIPTION);
        log("");

        StringWriter writer = new StringWriter();
        try (PrintWriter pw = new PrintWriter(writer)) {
            HelpFormatter formatter = new HelpFormatter();
            formatter.printHelp(pw, formatter.getWidth(), " ", "", options,
                    formatter.getLeftPadding(), formatter.getDescPadding(), "", true);
        }

        log(writer.toString());
    }

    /**
     * Parser for CLI arguments.
     *
     * @param options Options instance.
     * @return Optional of CommandLine.
     */
    public Optional<CommandLine> parseArgs(Options options) {
        CommandLine cmd = null;

        try {
            cmd = new DefaultParser().parse(options, args);
        } catch (Exception e) {
            log("Options error: " + e.getMessage());
            log("");
            optionsUsage(options);
        }

        return Optional.ofNullable(cmd);
    }

    /**
     * Gets args.
     *
     * @return String array.
     */
    public String[] getArgs() {
        return args;
    }

    /**
     * Gets exit code.
     *
     * @return Exit code.
     */
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Logging wrapper.
     *
     * @param string String.
     */
    public void log(String string) {
        System.out.println(string);
    }
}
