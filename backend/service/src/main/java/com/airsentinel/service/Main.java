package com.airsentinel.service;

import com.airsentinel.core.aqi.AqiClassifier;
import com.airsentinel.core.bus.EventBus;
import com.airsentinel.core.model.CitySource;
import com.airsentinel.ingest.api.CollectorContext;
import com.airsentinel.ingest.collector.AirQualityCollector;
import com.airsentinel.ingest.config.IngestionConfig;
import com.airsentinel.ingest.fetch.ReadingFetcher;
import com.airsentinel.ingest.openaq.OpenAqClient;
import com.airsentinel.ingest.retry.RetryPolicy;
import com.airsentinel.service.api.ApiServer;
import com.airsentinel.service.api.PipelineStatusTracker;
import com.airsentinel.service.config.ConfigLoader;
import com.airsentinel.service.config.ForecastConfig;
import com.airsentinel.service.forecast.FeatureSpec;
import com.airsentinel.service.forecast.ForecastTrainer;
import com.airsentinel.service.forecast.ForecastTrainingCollector;
import com.airsentinel.service.forecast.ModelArtifactRepository;
import com.airsentinel.service.forecast.ModelRegistry;
import com.airsentinel.service.query.CityCatalog;
import com.airsentinel.service.query.CurrentReadingService;
import com.airsentinel.service.query.ForecastService;
import com.airsentinel.service.runtime.SchedulerService;
import com.airsentinel.service.store.JsonlEventStore;
import com.airsentinel.service.store.TimeSeriesStore;

import java.io.IOException;
import java.io.InputStream;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.function.Consumer;
import java.util.logging.LogManager;
import java.util.logging.Logger;

public final class Main {
    private static final Logger LOGGER = Logger.getLogger(Main.class.getName());
    private static final int DEFAULT_PORT = 8080;
    private static final int API_THREADS = 8;

    private Main() {
    }

    public static void main(String[] args) throws InterruptedException {
        configureLogging();
        Path configDir = Path.of("config");
        Path dataDir = Path.of("data");
        Path eventLogFile = Path.of("logs/events.jsonl");
        RuntimeSettings settings = resolveRuntimeSettings(System.getenv(), LOGGER::warning);

        List<CitySource> citySources = ConfigLoader.loadCities(configDir);
        IngestionConfig ingestionConfig = ConfigLoader.loadIngestion(configDir);
        ForecastConfig forecastConfig = ConfigLoader.loadForecast(configDir);
        CityCatalog cities = new CityCatalog(citySources.stream().map(CitySource::name).toList());
        Clock clock = Clock.systemUTC();

        EventBus eventBus = new EventBus();
        JsonlEventStore eventStore = new JsonlEventStore(eventLogFile);
        eventBus.subscribeAll(eventStore::append);
        PipelineStatusTracker statusTracker = new PipelineStatusTracker(eventBus);

        AqiClassifier classifier = new AqiClassifier();
        TimeSeriesStore store = new TimeSeriesStore(classifier, dataDir.resolve("series"));
        ModelRegistry registry = new ModelRegistry(new ModelArtifactRepository(dataDir.resolve("models")));

        HttpClient httpClient = HttpClient.newBuilder()
                .connectTimeout(ingestionConfig.requestTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        OpenAqClient provider = new OpenAqClient(
                httpClient,
                settings.openAqBaseUrl(),
                ingestionConfig.requestTimeout(),
                settings.openAqApiKey(),
                ingestionConfig.countryId()
        );
        ReadingFetcher fetcher = new ReadingFetcher(
                provider,
                new RetryPolicy("openaq", ingestionConfig.retry()),
                ingestionConfig.pageSize(),
                citySources
        );
        ExecutorService ingestionExecutor = Executors.newFixedThreadPool(ingestionConfig.parallelism());
        ExecutorService trainingExecutor = Executors.newSingleThreadExecutor();
        AirQualityCollector ingestion = new AirQualityCollector(fetcher, cities.names(), ingestionConfig, ingestionExecutor);
        ForecastTrainer trainer = new ForecastTrainer(
                store,
                registry,
                cities,
                FeatureSpec.hourly(forecastConfig.minHistoryHours()),
                eventBus,
                clock
        );
        ForecastTrainingCollector training = new ForecastTrainingCollector(trainer, forecastConfig.trainingInterval(), trainingExecutor);

        CollectorContext context = new CollectorContext(eventBus, store, clock, Map.of());
        SchedulerService scheduler = new SchedulerService(List.of(
                new SchedulerService.ScheduledCollector(ingestion, ingestion.interval(), settings.schedulerEnabled()),
                new SchedulerService.ScheduledCollector(training, training.interval(), settings.schedulerEnabled())
        ), context);

        ApiServer apiServer = new ApiServer(
                settings.port(),
                API_THREADS,
                new CurrentReadingService(store, cities, classifier),
                new ForecastService(registry, store, cities, classifier, forecastConfig),
                registry,
                eventStore,
                statusTracker
        );
        apiServer.start();

        if (settings.schedulerEnabled()) {
            scheduler.runOnceInOrder();
            scheduler.startDeferred();
        } else {
            LOGGER.info("SCHEDULER_ENABLED=false; serving stored data only.");
        }

        CountDownLatch shutdownLatch = new CountDownLatch(1);
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.shutdown();
            apiServer.stop();
            ingestionExecutor.shutdownNow();
            trainingExecutor.shutdownNow();
            shutdownLatch.countDown();
        }));

        shutdownLatch.await();
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
            throw new IllegalStateException("Failed loading logging.properties", e);
        }
    }

    static RuntimeSettings resolveRuntimeSettings(Map<String, String> env, Consumer<String> warn) {
        int port = DEFAULT_PORT;
        String portRaw = env.get("PORT");
        if (portRaw != null && !portRaw.isBlank()) {
            try {
                port = Integer.parseInt(portRaw.trim());
            } catch (NumberFormatException e) {
                warn.accept("Invalid PORT=" + portRaw + ", defaulting to " + DEFAULT_PORT);
            }
        }

        String apiKey = env.getOrDefault("OPENAQ_API_KEY", "").trim();
        if (apiKey.isEmpty()) {
            warn.accept("OPENAQ_API_KEY is not set; OpenAQ requests will be unauthenticated and may be rejected");
        }

        String baseUrl = env.getOrDefault("OPENAQ_BASE_URL", OpenAqClient.DEFAULT_BASE_URL).trim();

        String schedulerRaw = env.getOrDefault("SCHEDULER_ENABLED", "true");
        boolean schedulerEnabled;
        if ("true".equalsIgnoreCase(schedulerRaw)) {
            schedulerEnabled = true;
        } else if ("false".equalsIgnoreCase(schedulerRaw)) {
            schedulerEnabled = false;
        } else {
            schedulerEnabled = true;
            warn.accept("Unknown SCHEDULER_ENABLED=" + schedulerRaw + ", defaulting to true");
        }

        return new RuntimeSettings(port, apiKey, baseUrl, schedulerEnabled);
    }

    record RuntimeSettings(int port, String openAqApiKey, String openAqBaseUrl, boolean schedulerEnabled) {
    }
}
