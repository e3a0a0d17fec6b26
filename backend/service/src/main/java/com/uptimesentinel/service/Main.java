package com.uptimesentinel.service;

import com.uptimesentinel.checker.http.HttpProbeChecker;
import com.uptimesentinel.core.bus.EventBus;
import com.uptimesentinel.core.model.Monitor;
import com.uptimesentinel.service.config.ConfigLoader;
import com.uptimesentinel.service.config.RuntimeSettings;
import com.uptimesentinel.service.http.HttpClientFactory;
import com.uptimesentinel.service.monitor.MonitorDefinition;
import com.uptimesentinel.service.monitor.MonitorService;
import com.uptimesentinel.service.notify.ChannelSenderRegistry;
import com.uptimesentinel.service.notify.NotificationDispatcher;
import com.uptimesentinel.service.runtime.MonitoringContext;
import com.uptimesentinel.service.runtime.PollingLoop;
import com.uptimesentinel.service.runtime.SchedulerService;
import com.uptimesentinel.service.runtime.WorkerService;
import com.uptimesentinel.service.runtime.WorkerTickResult;
import com.uptimesentinel.service.store.EventCodec;
import com.uptimesentinel.service.store.EventStore;
import com.uptimesentinel.service.store.JsonFileJobQueue;
import com.uptimesentinel.service.store.JsonFileMonitorRegistry;
import com.uptimesentinel.service.store.JsonFileSettingsStore;
import com.uptimesentinel.service.store.JsonlEventStore;
import com.uptimesentinel.service.store.JsonlStatusHistoryStore;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    static final String USAGE = "usage: uptime-sentinel <scheduler|worker|run|once|purge|import <file>|events [limit] [type]>";
    static final int DEFAULT_EVENT_LIMIT = 20;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        List<String> arguments = List.of(args);
        String command = arguments.isEmpty() ? "run" : arguments.get(0);
        if (!command.equals("scheduler") && !command.equals("worker") && !command.equals("run")) {
            System.exit(runCommand(arguments, System.getenv(), System.out, System.err));
            return;
        }

        Services services = wire(System.getenv(), Clock.systemUTC());
        List<PollingLoop> loops = new ArrayList<>();
        if (!command.equals("worker")) {
            loops.add(new PollingLoop("scheduler", services.settings().schedulerInterval(), services.scheduler()::runTick));
        }
        if (!command.equals("scheduler")) {
            loops.add(new PollingLoop("worker", services.settings().workerInterval(), services.worker()::runTick));
        }
        loops.forEach(PollingLoop::start);

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutting down");
            loops.forEach(PollingLoop::stop);
            shutdownLatch.countDown();
        }));
        shutdownLatch.await();
    }

    static int runCommand(List<String> args, Map<String, String> env, PrintStream out, PrintStream err) {
        if (args.isEmpty()) {
            err.println(USAGE);
            return 2;
        }
        switch (args.get(0)) {
            case "once" -> {
                Services services = wire(env, Clock.systemUTC());
                int scheduled = services.scheduler().runTick();
                WorkerTickResult result = services.worker().runTick();
                out.println("scheduled=" + scheduled + " claimed=" + result.claimed()
                        + " recorded=" + result.recorded() + " failed=" + result.failed());
                return 0;
            }
            case "purge" -> {
                Services services = wire(env, Clock.systemUTC());
                out.println("purged=" + services.worker().purgeOldJobs());
                return 0;
            }
            case "import" -> {
                if (args.size() < 2) {
                    err.println(USAGE);
                    return 2;
                }
                Services services = wire(env, Clock.systemUTC());
                return importMonitors(services.monitorService(), Path.of(args.get(1)), out, err);
            }
            case "events" -> {
                int limit = DEFAULT_EVENT_LIMIT;
                if (args.size() > 1) {
                    try {
                        limit = Integer.parseInt(args.get(1));
                    } catch (NumberFormatException ex) {
                        err.println("Invalid event limit: " + args.get(1));
                        err.println(USAGE);
                        return 2;
                    }
                }
                Optional<String> type = args.size() > 2 ? Optional.of(args.get(2)) : Optional.empty();
                Services services = wire(env, Clock.systemUTC());
                services.events().query(Instant.EPOCH, type, limit)
                        .forEach(event -> out.println(EventCodec.toJsonLine(event)));
                return 0;
            }
            default -> {
                err.println("Unknown command: " + args.get(0));
                err.println(USAGE);
                return 2;
            }
        }
    }

    static Services wire(Map<String, String> env, Clock clock) {
        Path dataDir = Path.of(env.getOrDefault("DATA_DIR", "data"));
        Path logDir = Path.of(env.getOrDefault("LOG_DIR", "logs"));

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(logDir.resolve("events.jsonl"));
        eventBus.subscribeAll(eventStore::append);

        JsonFileSettingsStore settingsStore = new JsonFileSettingsStore(dataDir.resolve("settings.json"), clock);
        RuntimeSettings settings = RuntimeSettings.resolve(settingsStore, env, LOGGER::warning);

        JsonFileMonitorRegistry monitors = new JsonFileMonitorRegistry(dataDir.resolve("monitors.json"));
        JsonFileJobQueue queue = new JsonFileJobQueue(dataDir.resolve("queue.json"), clock);
        MonitoringContext context = new MonitoringContext(
                monitors,
                new JsonlStatusHistoryStore(dataDir.resolve("history.jsonl")),
                queue,
                eventBus,
                clock
        );

        HttpClient httpClient = HttpClientFactory.create(Duration.ofSeconds(10), env);
        ChannelSenderRegistry channels = ChannelSenderRegistry.withDefaults(httpClient, Duration.ofSeconds(10));
        NotificationDispatcher dispatcher = new NotificationDispatcher(channels, eventBus, clock);

        return new Services(
                settings,
                eventStore,
                context,
                new SchedulerService(context),
                new WorkerService(
                        context,
                        new HttpProbeChecker(httpClient),
                        dispatcher,
                        settings.concurrencyLimit(),
                        settings.retentionDays(),
                        settings.purgeEveryTicks()
                ),
                new MonitorService(
                        monitors,
                        queue,
                        channels,
                        clock,
                        settings.defaultCheckIntervalSeconds(),
                        settings.defaultTimeoutSeconds()
                )
        );
    }

    private static int importMonitors(MonitorService monitorService, Path file, PrintStream out, PrintStream err) {
        List<MonitorDefinition> definitions = ConfigLoader.loadMonitorDefinitions(file);
        int rejected = 0;
        for (MonitorDefinition definition : definitions) {
            try {
                Monitor monitor = monitorService.create(definition);
                out.println("created " + monitor.id() + " " + monitor.url());
            } catch (IllegalArgumentException | NullPointerException ex) {
                rejected++;
                err.println("rejected " + definition.url() + ": " + ex.getMessage());
            }
        }
        return rejected == 0 ? 0 : 1;
    }

    private static void configureLogging() {
        if (System.getProperty("java.util.logging.config.file") != null) {
            return;
        }
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        } catch (IOException e) {
            LOGGER.warning("Unable to load bundled logging.properties: " + e.getMessage());
        }
    }

    record Services(
            RuntimeSettings settings,
            EventStore events,
            MonitoringContext context,
            SchedulerService scheduler,
            WorkerService worker,
            MonitorService monitorService
    ) {
    }
}
