package org.conductor.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conductor.api.signals.Signal;
import org.conductor.cli.CommandLineInterface;
import org.conductor.config.ConductorConfigurator;
import org.conductor.core.Conductor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts all configured services and runs until they are shut down."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"--no-signals"}, description = "Do not stop the services on SIGTERM/SIGINT.")
    private boolean noSignals;

    @Override
    public Integer call() {
        Config config = parent.getConfig();
        if (!noSignals) {
            config = ConfigFactory.parseString("conductor.options.hook-signals = true").withFallback(config);
        }

        final Conductor conductor = ConductorConfigurator.build(config);
        final Signal completion = conductor.start();

        if (conductor.getStartupFailure().isPresent()) {
            LOGGER.error("Startup failed: {}", conductor.getStartupFailure().get().getMessage());
            return 1;
        }

        LOGGER.info("All services running. Waiting for shutdown...");
        try {
            completion.await();
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            conductor.stop();
        }
        LOGGER.info("All services stopped. Goodbye.");
        return 0;
    }
}
