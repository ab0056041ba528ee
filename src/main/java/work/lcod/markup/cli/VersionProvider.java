package work.lcod.markup.cli;

import picocli.CommandLine;

/**
 * Reports the artifact version from the jar manifest plus the runtime the sandbox workers will inherit.
 */
final class VersionProvider implements CommandLine.IVersionProvider {
    static final String ARTIFACT = "lcod-markup-core";

    @Override
    public String[] getVersion() {
        Package pkg = Main.class.getPackage();
        String title = pkg == null ? null : pkg.getImplementationTitle();
        String version = pkg == null ? null : pkg.getImplementationVersion();
        return new String[] {
            (title != null ? title : ARTIFACT) + " " + (version != null ? version : "development"),
            "Java " + System.getProperty("java.version") + " (" + System.getProperty("java.vendor") + ")"
        };
    }
}
