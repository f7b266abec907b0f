package com.kmg.pageocr.config;

import com.kmg.pageocr.engine.RecognizerEngine;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;

@Validated
@ConfigurationProperties(prefix = "pageocr")
public class PageOcrProperties {
    @NotNull
    private Output output = new Output();
    @NotNull
    private Render render = new Render();
    @NotNull
    private Recognizer recognizer = new Recognizer();
    @NotNull
    private Pipeline pipeline = new Pipeline();
    @NotNull
    private Entities entities = new Entities();

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public Render getRender() {
        return render;
    }

    public void setRender(Render render) {
        this.render = render;
    }

    public Recognizer getRecognizer() {
        return recognizer;
    }

    public void setRecognizer(Recognizer recognizer) {
        this.recognizer = recognizer;
    }

    public Pipeline getPipeline() {
        return pipeline;
    }

    public void setPipeline(Pipeline pipeline) {
        this.pipeline = pipeline;
    }

    public Entities getEntities() {
        return entities;
    }

    public void setEntities(Entities entities) {
        this.entities = entities;
    }

    /**
     * Snapshot of the run-relevant settings. Components receive this value instead of reading
     * the mutable properties bean.
     */
    public PipelineConfig toPipelineConfig() {
        return new PipelineConfig(
                Path.of(output.getDir()).toAbsolutePath().normalize(),
                render.getDpi(),
                render.getImageFormat(),
                recognizer.getLanguage(),
                PipelineConfig.resolveConcurrency(pipeline.getConcurrency())
        );
    }

    public static class Output {
        @NotBlank
        private String dir = ".";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }

    public static class Render {
        @Min(36)
        @Max(1200)
        private int dpi = 300;
        @NotBlank
        private String imageFormat = "png";

        public int getDpi() {
            return dpi;
        }

        public void setDpi(int dpi) {
            this.dpi = dpi;
        }

        public String getImageFormat() {
            return imageFormat;
        }

        public void setImageFormat(String imageFormat) {
            this.imageFormat = imageFormat;
        }
    }

    public static class Recognizer {
        @NotNull
        private RecognizerEngine engine = RecognizerEngine.TESSERACT;
        @NotBlank
        private String language = "eng";
        private String tessdataPath;
        private String credentialsPath;

        public RecognizerEngine getEngine() {
            return engine;
        }

        public void setEngine(RecognizerEngine engine) {
            this.engine = engine;
        }

        public String getLanguage() {
            return language;
        }

        public void setLanguage(String language) {
            this.language = language;
        }

        public String getTessdataPath() {
            return tessdataPath;
        }

        public void setTessdataPath(String tessdataPath) {
            this.tessdataPath = tessdataPath;
        }

        public String getCredentialsPath() {
            return credentialsPath;
        }

        public void setCredentialsPath(String credentialsPath) {
            this.credentialsPath = credentialsPath;
        }
    }

    public static class Pipeline {
        // 0 means one worker per available processor.
        @Min(0)
        @Max(256)
        private int concurrency = 0;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }
    }

    public static class Entities {
        private String modelPath;

        public String getModelPath() {
            return modelPath;
        }

        public void setModelPath(String modelPath) {
            this.modelPath = modelPath;
        }
    }
}
