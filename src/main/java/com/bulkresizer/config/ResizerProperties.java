package com.bulkresizer.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@ConfigurationProperties(prefix = "resizer")
public class ResizerProperties {

    /** Output directory used when a run does not name one */
    private String destDir = "./resize/";

    /** Number of parallel workers; 0 means one per available processor */
    private int concurrency = 0;

    /** Number of jobs handed to a worker at once */
    private int chunkSize = 16;

    /** JPEG quality, conventionally 1-95 */
    private int quality = 80;

    /** Resample filter name: NEAREST, BILINEAR, BICUBIC or LANCZOS */
    private String resample = "NEAREST";

    // ───────────── getters / setters ─────────────

    public String getDestDir() {
        return destDir;
    }

    public void setDestDir(String destDir) {
        this.destDir = destDir;
    }

    public int getConcurrency() {
        return concurrency;
    }

    public void setConcurrency(int concurrency) {
        this.concurrency = concurrency;
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        this.chunkSize = chunkSize;
    }

    public int getQuality() {
        return quality;
    }

    public void setQuality(int quality) {
        this.quality = quality;
    }

    public String getResample() {
        return resample;
    }

    public void setResample(String resample) {
        this.resample = resample;
    }
}
