package aquabase.app;

import java.time.Clock;
import java.time.Duration;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.concurrent.BasicThreadFactory;
import org.eclipse.paho.client.mqttv3.MqttClient;
import org.eclipse.paho.client.mqttv3.MqttException;
import org.eclipse.paho.client.mqttv3.persist.MemoryPersistence;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.InjectionPoint;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Scope;
import org.springframework.core.env.Environment;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.impl.StrictExceptionHandler;

import aquabase.app.control.DeviceControlService;
import aquabase.app.correlation.InMemoryResponseStore;
import aquabase.app.correlation.ResponseCorrelator;
import aquabase.app.correlation.ResponseStore;
import aquabase.app.device.TopologyService;
import aquabase.app.liveness.LivenessTracker;
import aquabase.app.message.CommandPublisher;
import aquabase.app.message.DeviceMessageHandler;
import aquabase.app.message.Mqtt;
import aquabase.app.message.PahoDeviceTransport;
import aquabase.app.notification.LoggingNotifier;
import aquabase.app.notification.Notifier;
import aquabase.app.notification.RabbitMqNotifier;
import aquabase.app.provider.AccountRepository;
import aquabase.app.provider.InMemoryAccountRepository;
import aquabase.app.provider.Metrics;
import aquabase.app.setup.ActionExecutor;
import aquabase.app.setup.RuleEvaluator;
import aquabase.app.setup.SetupService;
import io.sentry.Sentry;
import jakarta.annotation.PreDestroy;

@SpringBootApplication
@EnableConfigurationProperties(AppProperties.class)
public class AquabaseApplication
{
    public static int exitCode = 1;

    public static final int EXIT_CODE_MQTT = 2;
    public static final int EXIT_CODE_SENTRY = 16;

    private static Logger log = LoggerFactory.getLogger(AquabaseApplication.class);

    @Bean
    public CommandLineRunner commandLineRunner(ApplicationContext ctx) {
        return args -> {
            String[] beanNames = ctx.getBeanDefinitionNames();
            Arrays.sort(beanNames);
            for (String beanName : beanNames) {
                log.debug(beanName);
            }
        };
    }

    @Bean
    public ExitCodeGenerator exitCodeGenerator() {
        return () -> exitCode;
    }

    @Bean
    @Scope("prototype")
    public Logger logger(InjectionPoint injectionPoint) {
        return LoggerFactory.getLogger(injectionPoint.getMember().getDeclaringClass());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public AccountRepository accountRepository() {
        return new InMemoryAccountRepository();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService scheduler() {
        return Executors.newScheduledThreadPool(2, new BasicThreadFactory.Builder()
            .namingPattern("app-scheduler-%d")
            .daemon(true)
            .build());
    }

    @Bean(destroyMethod = "shutdown")
    public ExecutorService eventExecutor() {
        return Executors.newCachedThreadPool(new BasicThreadFactory.Builder()
            .namingPattern("app-event-%d")
            .daemon(true)
            .build());
    }

    @Bean
    public ResponseStore responseStore(Clock clock, AppProperties props) {
        return new InMemoryResponseStore(clock, Duration.ofSeconds(props.getResponseRetentionSeconds()));
    }

    @Bean
    public ResponseCorrelator responseCorrelator(ResponseStore responseStore, ScheduledExecutorService scheduler, Clock clock, AppProperties props) {
        return new ResponseCorrelator(responseStore, scheduler, clock, Duration.ofMillis(props.getCorrelationPollIntervalMs()));
    }

    /**
     * Created disconnected; {@link #main(String[])} connects it once the context is up.
     */
    @Bean
    public PahoDeviceTransport deviceTransport(AppProperties props) throws MqttException {
        final String host = StringUtils.defaultIfBlank(props.getMqttServerAddress(), "localhost");
        final MqttClient mqttClient = new MqttClient(
            String.format("tcp://%s:%d", host, props.getMqttServerPort()),
            UUID.randomUUID().toString(),
            new MemoryPersistence());
        return new PahoDeviceTransport(mqttClient);
    }

    @Bean
    public CommandPublisher commandPublisher(PahoDeviceTransport deviceTransport, ObjectMapper objectMapper) {
        return new CommandPublisher(deviceTransport, objectMapper);
    }

    @Bean
    public Notifier notifier(AppProperties props) {
        final String host = props.getRabbitmqServerAddress();
        if (StringUtils.isBlank(host)) {
            log.info("No RabbitMQ server configured, notifications are logged only.");
            return new LoggingNotifier();
        }
        final ConnectionFactory rabbitMqConnectionFactory = new ConnectionFactory();
        rabbitMqConnectionFactory.setHost(host);
        rabbitMqConnectionFactory.setExceptionHandler(new StrictExceptionHandler() {
            @Override
            public void handleUnexpectedConnectionDriverException(Connection conn, Throwable exception) {
                log.warn("Handling RabbitMQ connection exception.", exception);
                super.handleUnexpectedConnectionDriverException(conn, exception);
            }
        });
        return new RabbitMqNotifier(rabbitMqConnectionFactory, props.getNotificationExchangeName(), props.getNotificationExpiryMs());
    }

    @Bean
    public TopologyService topologyService(AccountRepository accountRepository, Clock clock) {
        return new TopologyService(accountRepository, clock);
    }

    @Bean
    public LivenessTracker livenessTracker(AccountRepository accountRepository, Notifier notifier, Clock clock, AppProperties props) {
        return new LivenessTracker(accountRepository, notifier, clock, Duration.ofSeconds(props.getOfflineTimeoutSeconds()));
    }

    @Bean
    public ActionExecutor actionExecutor(AccountRepository accountRepository, CommandPublisher commandPublisher, Notifier notifier, Clock clock) {
        return new ActionExecutor(accountRepository, commandPublisher, notifier, clock);
    }

    @Bean
    public RuleEvaluator ruleEvaluator(AccountRepository accountRepository, ActionExecutor actionExecutor, Clock clock) {
        return new RuleEvaluator(accountRepository, actionExecutor, clock);
    }

    @Bean
    public DeviceControlService deviceControlService(TopologyService topologyService, AccountRepository accountRepository,
            CommandPublisher commandPublisher, ResponseCorrelator responseCorrelator, RuleEvaluator ruleEvaluator,
            Notifier notifier, Clock clock, AppProperties props) {
        return new DeviceControlService(topologyService, accountRepository, commandPublisher, responseCorrelator,
            ruleEvaluator, notifier, clock, props.correlationTimeouts());
    }

    @Bean
    public SetupService setupService(AccountRepository accountRepository, DeviceControlService deviceControlService, Clock clock) {
        return new SetupService(accountRepository, deviceControlService, clock);
    }

    @Bean
    public DeviceMessageHandler deviceMessageHandler(AccountRepository accountRepository, ResponseStore responseStore,
            LivenessTracker livenessTracker, RuleEvaluator ruleEvaluator, Notifier notifier, Clock clock) {
        return new DeviceMessageHandler(accountRepository, responseStore, livenessTracker, ruleEvaluator, notifier, clock);
    }

    @Bean
    public Mqtt mqtt(@Qualifier("eventExecutor") ExecutorService eventExecutor, DeviceMessageHandler deviceMessageHandler, PahoDeviceTransport deviceTransport) {
        return new Mqtt(eventExecutor, deviceMessageHandler, deviceTransport);
    }

    @PreDestroy
    private void shutdown() {
        Metrics.getInstance().postMetric("shutdown");
        log.info("Full shutdown complete.");
    }

    public static void main( String[] args )
    {
        Thread.currentThread().setName("main");
        final Map<String, String> envVars = System.getenv();
        final String sentryDsn = envVars.get("SENTRY_DSN");
        if (StringUtils.isNotBlank(sentryDsn)) {
            try {
                Sentry.init(options -> {
                    options.setDsn(sentryDsn);
                    options.setTracesSampleRate(1.0);
                });
            } catch (IllegalArgumentException e) {
                log.error("Problem with Sentry client", e);
                exitCode |= EXIT_CODE_SENTRY;
                System.exit(exitCode);
            }
        }
        log.info("Sentry enabled: {}.", Sentry.isEnabled());
        final ApplicationContext springApp = SpringApplication.run(AquabaseApplication.class, args);
        final Environment springEnv = springApp.getEnvironment();
        final AppProperties props = springApp.getBean(AppProperties.class);
        final Locale locale = Locale.getDefault();
        log.info("{} starting {} in working directory {}, locale language {}, country {} and environment {}",
            springEnv.getProperty("app.project-name"),
            Runtime.version().toString(),
            System.getProperty("user.dir"),
            locale.getLanguage(),
            locale.getCountry(),
            envVars.keySet());

        final PahoDeviceTransport transport = springApp.getBean(PahoDeviceTransport.class);
        try {
            transport.connect(springApp.getBean(Mqtt.class), props.getMqttConnectTimeoutSeconds());
        } catch (MqttException e) {
            log.error("Problem with MQTT client", e);
            Sentry.captureException(e);
            exitCode |= EXIT_CODE_MQTT;
            System.exit(SpringApplication.exit(springApp));
        }

        final LivenessTracker liveness = springApp.getBean(LivenessTracker.class);
        final long sweepSeconds = props.getLivenessSweepSeconds();
        springApp.getBean(ScheduledExecutorService.class).scheduleAtFixedRate(() -> {
            try {
                liveness.sweep();
            } catch (RuntimeException e) {
                log.error("Liveness sweep failed.", e);
                Sentry.captureException(e);
            }
        }, sweepSeconds, sweepSeconds, TimeUnit.SECONDS);

        Metrics.getInstance().postMetric("startup");
        log.info("{} startup complete.", springEnv.getProperty("app.project-name"));
        exitCode = 0;
    }
}
