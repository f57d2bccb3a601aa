package org.openphc.skeleton;

import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.config.AppConfiguration;
import org.openphc.skeleton.config.ConfigurationException;
import org.openphc.skeleton.config.ConfigurationLoader;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Function;

/**
 * Entry point. Configuration is loaded and validated before Spring starts; a configuration
 * failure exits the process with status 1 without ever opening the server port.
 */
@SpringBootApplication
@Slf4j
public class SkeletonApplication {

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIGURATION_FAILURE = 1;
    static final String CONFIGURATION_BEAN = "appConfiguration";

    public static void main(String[] args) {
        int exitCode = run(ConfigurationLoader.forCurrentProcess(), SkeletonApplication::createApplication, args);
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    /**
     * Load the configuration and start the application built from it.
     *
     * @return {@link #EXIT_CONFIGURATION_FAILURE} when the configuration cannot be loaded, in which
     *         case no application is built; {@link #EXIT_OK} once the application has started
     */
    static int run(ConfigurationLoader loader, Function<AppConfiguration, SpringApplication> applicationFactory,
                   String[] args) {
        AppConfiguration configuration;
        try {
            configuration = loader.load();
        } catch (ConfigurationException e) {
            log.error("Unable to load configuration: {}", e.getMessage(), e);
            return EXIT_CONFIGURATION_FAILURE;
        }

        applicationFactory.apply(configuration).run(args);
        return EXIT_OK;
    }

    /**
     * Spring application bound to an already-loaded configuration snapshot, which is registered
     * as a singleton bean and drives the server port and address.
     */
    static SpringApplication createApplication(AppConfiguration configuration) {
        SpringApplication application = new SpringApplication(SkeletonApplication.class);

        Map<String, Object> defaults = new HashMap<>();
        defaults.put("server.port", configuration.getServer().port());
        if (configuration.get("host") != null) {
            defaults.put("server.address", configuration.getServer().host());
        }
        application.setDefaultProperties(defaults);

        application.addInitializers(context ->
                context.getBeanFactory().registerSingleton(CONFIGURATION_BEAN, configuration));
        return application;
    }
}
