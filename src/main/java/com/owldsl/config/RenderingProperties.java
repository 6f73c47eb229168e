// com/owldsl/config/RenderingProperties.java
package com.owldsl.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Externalised settings for rendering runs
 */
@ConfigurationProperties(prefix = "rendering")
public class RenderingProperties {

    private String configurationFile;
    private String ontologyFile;
    private String ontologyNamespace;
    private String ontologyLabel;
    private boolean exactClassLabels = false;
    private int maxRenderDepth = CnlConfiguration.DEFAULT_MAX_RENDER_DEPTH;
    private String outputDirectory = "./output";
    private int progressInterval = 500;
    private String promptField = "prompt";
    private String completionField = "completion";

    // Getters and setters
    public String getConfigurationFile() { return configurationFile; }
    public void setConfigurationFile(String configurationFile) { this.configurationFile = configurationFile; }

    public String getOntologyFile() { return ontologyFile; }
    public void setOntologyFile(String ontologyFile) { this.ontologyFile = ontologyFile; }

    public String getOntologyNamespace() { return ontologyNamespace; }
    public void setOntologyNamespace(String ontologyNamespace) { this.ontologyNamespace = ontologyNamespace; }

    /**
     * Overrides the title read from the ontology header
     */
    public String getOntologyLabel() { return ontologyLabel; }
    public void setOntologyLabel(String ontologyLabel) { this.ontologyLabel = ontologyLabel; }

    public boolean isExactClassLabels() { return exactClassLabels; }
    public void setExactClassLabels(boolean exactClassLabels) { this.exactClassLabels = exactClassLabels; }

    public int getMaxRenderDepth() { return maxRenderDepth; }
    public void setMaxRenderDepth(int maxRenderDepth) { this.maxRenderDepth = maxRenderDepth; }

    public String getOutputDirectory() { return outputDirectory; }
    public void setOutputDirectory(String outputDirectory) { this.outputDirectory = outputDirectory; }

    public int getProgressInterval() { return progressInterval; }
    public void setProgressInterval(int progressInterval) { this.progressInterval = progressInterval; }

    public String getPromptField() { return promptField; }
    public void setPromptField(String promptField) { this.promptField = promptField; }

    public String getCompletionField() { return completionField; }
    public void setCompletionField(String completionField) { this.completionField = completionField; }

    @Override
    public String toString() {
        return "RenderingProperties{" +
                "configurationFile='" + configurationFile + '\'' +
                ", ontologyFile='" + ontologyFile + '\'' +
                ", ontologyNamespace='" + ontologyNamespace + '\'' +
                ", exactClassLabels=" + exactClassLabels +
                ", maxRenderDepth=" + maxRenderDepth +
                ", outputDirectory='" + outputDirectory + '\'' +
                '}';
    }
}
