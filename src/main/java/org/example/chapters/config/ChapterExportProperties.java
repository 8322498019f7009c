package org.example.chapters.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "chapters.export")
public class ChapterExportProperties {

    private String outputDir = "output";
    private String imageDir = "images";
    private boolean prettyPrint = true;

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir == null || outputDir.isBlank() ? "output" : outputDir;
    }

    /**
     * Directory, relative to the Markdown file, that holds downloaded images.
     */
    public String getImageDir() {
        return imageDir;
    }

    public void setImageDir(String imageDir) {
        this.imageDir = imageDir == null || imageDir.isBlank() ? "images" : imageDir;
    }

    public boolean isPrettyPrint() {
        return prettyPrint;
    }

    public void setPrettyPrint(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
    }
}
