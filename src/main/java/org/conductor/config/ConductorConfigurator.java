package org.conductor.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.conductor.api.services.IService;
import org.conductor.core.Conductor;
import org.conductor.core.ConductorOptions;
import org.conductor.core.IShutdownHookRegistry;
import org.conductor.core.RuntimeShutdownHookRegistry;
import org.conductor.core.ServiceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Assembles a {@link Conductor} from configuration.
 * <p>
 * Services are declared as an ordered list, which is also their startup order. Each service class
 * must implement {@link IService} and expose a public {@code (String name, Config options)}
 * constructor.
 *
 * <pre>
 * conductor {
 *   options { ... }
 *   services = [
 *     { name = "clock", className = "org.conductor.services.HeartbeatService", options { interval = 2s } }
 *   ]
 * }
 * </pre>
 * Any invalid service definition fails the whole assembly.
 */
public final class ConductorConfigurator {

    private static final Logger LOGGER = LoggerFactory.getLogger(ConductorConfigurator.class);
    private static final String CONDUCTOR_CONFIG_PATH = "conductor";
    private static final String OPTIONS_PATH = CONDUCTOR_CONFIG_PATH + ".options";
    private static final String SERVICES_PATH = CONDUCTOR_CONFIG_PATH + ".services";

    private ConductorConfigurator() {
    }

    /**
     * Reads {@code conductor.options}, absent keys keep their defaults.
     *
     * @param config The application configuration.
     * @return The options.
     */
    public static ConductorOptions readOptions(final Config config) {
        return config.hasPath(OPTIONS_PATH)
            ? ConductorOptions.fromConfig(config.getConfig(OPTIONS_PATH))
            : ConductorOptions.defaults();
    }

    /**
     * Creates a conductor and registers every configured service in list order.
     *
     * @param config The application configuration.
     * @return The conductor, not yet started.
     * @throws IllegalArgumentException if a service definition is invalid or cannot be instantiated.
     */
    public static Conductor build(final Config config) {
        return build(config, new RuntimeShutdownHookRegistry());
    }

    /**
     * Like {@link #build(Config)}, with the registry the termination hook is installed in.
     * Every service is instantiated before the conductor exists, so an invalid definition
     * leaves no hook behind.
     *
     * @param config       The application configuration.
     * @param hookRegistry Where the termination hook goes when {@code hook-signals} is enabled.
     * @return The conductor, not yet started.
     * @throws IllegalArgumentException if a service definition is invalid or cannot be instantiated.
     */
    public static Conductor build(final Config config, final IShutdownHookRegistry hookRegistry) {
        final ConductorOptions options = readOptions(config);
        final List<Map.Entry<String, IService>> instances = new ArrayList<>();

        if (!config.hasPath(SERVICES_PATH)) {
            LOGGER.warn("Configuration path '{}' not found. No services will be registered.", SERVICES_PATH);
        } else {
            final List<? extends Config> definitions = config.getConfigList(SERVICES_PATH);
            LOGGER.debug("Found {} configured service(s).", definitions.size());
            for (int i = 0; i < definitions.size(); i++) {
                final Config definition = definitions.get(i);
                if (!definition.hasPath("name") || !definition.hasPath("className")) {
                    throw new IllegalArgumentException("Service definition #" + i + " requires 'name' and 'className'.");
                }
                final String name = definition.getString("name");
                final String className = definition.getString("className");
                final Config serviceOptions = definition.hasPath("options")
                    ? definition.getConfig("options")
                    : ConfigFactory.empty();

                instances.add(Map.entry(name, instantiate(name, className, serviceOptions)));
                LOGGER.debug("Created service '{}' (class: {})", name, className);
            }
        }

        final Conductor conductor = new Conductor(options, hookRegistry);
        for (final Map.Entry<String, IService> instance : instances) {
            conductor.service(instance.getKey(), instance.getValue());
        }
        if (!instances.isEmpty()) {
            LOGGER.info("Registered {} service(s): {}", instances.size(),
                conductor.getServices().stream().map(ServiceRecord::getName).toList());
        }
        return conductor;
    }

    private static IService instantiate(final String name, final String className, final Config options) {
        try {
            final Class<?> serviceClass = Class.forName(className);
            if (!IService.class.isAssignableFrom(serviceClass)) {
                throw new IllegalArgumentException("Class " + className + " does not implement IService.");
            }
            final Constructor<?> constructor = serviceClass.getConstructor(String.class, Config.class);
            return (IService) constructor.newInstance(name, options);
        } catch (final ClassNotFoundException e) {
            throw new IllegalArgumentException("Service class not found for '" + name + "': " + className, e);
        } catch (final NoSuchMethodException e) {
            throw new IllegalArgumentException("Class " + className + " has no public (String, Config) constructor.", e);
        } catch (final InvocationTargetException e) {
            throw new IllegalArgumentException("Failed to create service '" + name + "': " + e.getCause().getMessage(), e.getCause());
        } catch (final InstantiationException | IllegalAccessException e) {
            throw new IllegalArgumentException("Failed to create service '" + name + "' from " + className, e);
        }
    }
}
