package work.lcod.dispatch.cli;

import java.io.IOException;
import java.io.InputStream;
import java.util.Properties;
import picocli.CommandLine;

/**
 * Reports the project version Maven filters into {@code version.properties}. The jar manifest is
 * the fallback for builds that skip resource filtering.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String RESOURCE = "version.properties";
    static final String UNKNOWN = "development";

    @Override
    public String[] getVersion() throws IOException {
        return new String[] { "graph-dispatch (java) " + version() };
    }

    static String version() throws IOException {
        Properties properties = new Properties();
        try (InputStream in = VersionProvider.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                properties.load(in);
            }
        }
        String version = properties.getProperty("version");
        if (version == null || version.isBlank() || version.startsWith("${")) {
            version = Main.class.getPackage().getImplementationVersion();
        }
        return version != null ? version : UNKNOWN;
    }
}
