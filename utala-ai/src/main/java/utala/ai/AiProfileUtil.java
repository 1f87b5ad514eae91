package utala.ai;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableList;

/**
 * Loads AI profiles ({@code ai/<Name>.ai} property files on the classpath) and reads typed
 * values from them. Loaded profiles are cached for the life of the process.
 */
public final class AiProfileUtil {
    public static final String DEFAULT_PROFILE = "Default";

    /** Profiles shipped with the application, in rough order of strength. */
    public static final List<String> PROFILES =
            ImmutableList.of("Fast", "Default", "Strong", "VeryStrong", "Ultra", "InfoSet");

    private static final String PROFILE_DIR = "ai/";
    private static final String PROFILE_EXT = ".ai";

    private static final Map<String, Properties> loaded = new ConcurrentHashMap<>();

    private AiProfileUtil() {
    }

    public static List<String> getAvailableProfiles() {
        return PROFILES;
    }

    /**
     * @throws IllegalArgumentException if no profile of that name is on the classpath
     */
    public static Properties getProfile(String profile) {
        String name = profile == null ? DEFAULT_PROFILE : profile;
        return loaded.computeIfAbsent(name, AiProfileUtil::load);
    }

    private static Properties load(String name) {
        String resource = PROFILE_DIR + name + PROFILE_EXT;
        InputStream in = AiProfileUtil.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new IllegalArgumentException("Unknown AI profile: " + name
                    + " (available: " + String.join(", ", PROFILES) + ")");
        }
        Properties props = new Properties();
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            props.load(reader);
        } catch (IOException e) {
            throw new IllegalStateException("Could not read AI profile " + resource, e);
        }
        return props;
    }

    public static String getProperty(String profile, AiProps prop) {
        String value = getProfile(profile).getProperty(prop.getKey());
        return value == null ? prop.getDefault() : value.trim();
    }

    public static int getIntProperty(String profile, AiProps prop) {
        String value = getProperty(profile, prop);
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Profile " + profile + ": " + prop.getKey()
                    + " is not a number: " + value, e);
        }
    }

    public static boolean getBoolProperty(String profile, AiProps prop) {
        return Boolean.parseBoolean(getProperty(profile, prop));
    }
}
