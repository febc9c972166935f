package de.anton.analemma;

import de.anton.analemma.controller.CommandLineController;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command-line entry point.
 */
public class App {
    private static final Logger logger = LoggerFactory.getLogger(App.class);

    public static void main(String[] args) {
        logger.debug("Starting with {} argument(s).", args.length);
        int exitCode = new CommandLineController(System.out, System.err).run(args);
        // A zero exit keeps the JVM alive while chart windows are open
        if (exitCode != CommandLineController.EXIT_OK) {
            System.exit(exitCode);
        }
    }
}
