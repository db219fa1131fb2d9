package org.carball.slowq.config;

import lombok.Data;
import java.nio.file.Path;

@Data
public class AnalyzerConfig {
    private String jdbcUrl;
    private String user;
    private String password;
    private Path snapshotFile;
    private Path slowLogFile;
    private Path ddlFile;
    private Path explainFile;
    private String schemaFilter;
    private boolean runExplain;
    private boolean resetDigests;
    private Path exportFile;
    private String outputFile;
    private OutputFormat outputFormat;
    private boolean verbose;
    private DiagnosticThresholds thresholds;

    public boolean isLiveSource() {
        return jdbcUrl != null;
    }
}
