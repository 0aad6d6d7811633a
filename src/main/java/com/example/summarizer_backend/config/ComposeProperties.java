package com.example.summarizer_backend.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * ffmpeg/ffprobe settings shared by probing, frame decoding and composition.
 */
@ConfigurationProperties(prefix = "compose")
public class ComposeProperties {
    private String ffmpegBinary = "ffmpeg";
    private String ffprobeBinary = "ffprobe";
    private String workDir = "./data/work";
    private long timeoutSeconds = 600;
    private int maxAttempts = 3;
    private long backoffMillis = 500;
    private String outputFormat = "mp4";
    private List<String> supportedFormats = List.of("mp4", "mov", "wmv", "avi", "mkv", "webm");

    public String getFfmpegBinary() {
        return ffmpegBinary;
    }

    public void setFfmpegBinary(String ffmpegBinary) {
        this.ffmpegBinary = ffmpegBinary;
    }

    public String getFfprobeBinary() {
        return ffprobeBinary;
    }

    public void setFfprobeBinary(String ffprobeBinary) {
        this.ffprobeBinary = ffprobeBinary;
    }

    public String getWorkDir() {
        return workDir;
    }

    public void setWorkDir(String workDir) {
        this.workDir = workDir;
    }

    public long getTimeoutSeconds() {
        return timeoutSeconds;
    }

    public void setTimeoutSeconds(long timeoutSeconds) {
        this.timeoutSeconds = timeoutSeconds;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffMillis() {
        return backoffMillis;
    }

    public void setBackoffMillis(long backoffMillis) {
        this.backoffMillis = backoffMillis;
    }

    public String getOutputFormat() {
        return outputFormat;
    }

    public void setOutputFormat(String outputFormat) {
        this.outputFormat = outputFormat;
    }

    public List<String> getSupportedFormats() {
        return supportedFormats;
    }

    public void setSupportedFormats(List<String> supportedFormats) {
        this.supportedFormats = supportedFormats;
    }
}
