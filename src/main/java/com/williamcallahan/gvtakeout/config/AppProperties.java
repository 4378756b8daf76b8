package com.williamcallahan.gvtakeout.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "app")
public class AppProperties {

    private Takeout takeout = new Takeout();
    private Import importRun = new Import();

    public Takeout getTakeout() {
        return takeout;
    }

    public void setTakeout(Takeout takeout) {
        this.takeout = takeout;
    }

    /**
     * Bound from {@code app.import.*}; the Java field cannot be named after the keyword.
     */
    public Import getImport() {
        return importRun;
    }

    public void setImport(Import importRun) {
        this.importRun = importRun;
    }

    /**
     * False only for a JSON import run, which never opens the database.
     */
    public boolean usesStore() {
        return !(importRun.isEnabled() && takeout.getFormat() == OutputFormat.JSON);
    }

    /**
     * Where conversations are written by an import run.
     */
    public enum OutputFormat {
        JSON,
        SQLITE
    }

    public static class Takeout {
        private String inputDir = ".";
        private OutputFormat format = OutputFormat.JSON;
        private boolean captureMedia = false;
        private String jsonOutput = "";

        public String getInputDir() { return inputDir; }
        public void setInputDir(String inputDir) { this.inputDir = inputDir; }

        public OutputFormat getFormat() { return format; }
        public void setFormat(OutputFormat format) { this.format = format; }

        public boolean isCaptureMedia() { return captureMedia; }
        public void setCaptureMedia(boolean captureMedia) { this.captureMedia = captureMedia; }

        /**
         * File receiving JSON lines; empty means standard output.
         */
        public String getJsonOutput() { return jsonOutput; }
        public void setJsonOutput(String jsonOutput) { this.jsonOutput = jsonOutput; }
    }

    public static class Import {
        private boolean enabled = false;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }
}
