package com.kmg.pageocr.engine;

import com.google.api.gax.core.FixedCredentialsProvider;
import com.google.api.gax.rpc.ApiException;
import com.google.auth.oauth2.GoogleCredentials;
import com.google.auth.oauth2.ServiceAccountCredentials;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageAnnotatorSettings;
import com.google.cloud.vision.v1.ImageContext;
import com.google.protobuf.ByteString;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Google Cloud Vision document text detection. The client is created on first use and shared;
 * {@link ImageAnnotatorClient} is thread-safe.
 */
public class CloudVisionTextRecognizer implements TextRecognizer, AutoCloseable {
    // Tesseract-style codes mapped to the BCP-47 hints Vision expects.
    private static final Map<String, String> LANGUAGE_HINTS = Map.of(
            "eng", "en",
            "deu", "de",
            "fra", "fr",
            "spa", "es",
            "ita", "it",
            "por", "pt",
            "kor", "ko",
            "jpn", "ja",
            "chi_sim", "zh"
    );

    private final Path credentialPath;
    private volatile ImageAnnotatorClient client;

    public CloudVisionTextRecognizer(Path credentialPath) {
        this.credentialPath = credentialPath;
    }

    @Override
    public String recognize(byte[] image, String languageHint) {
        try {
            ImageContext.Builder context = ImageContext.newBuilder();
            toLanguageHints(languageHint).forEach(context::addLanguageHints);

            AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                    .setImage(Image.newBuilder().setContent(ByteString.copyFrom(image)).build())
                    .addFeatures(Feature.newBuilder().setType(Feature.Type.DOCUMENT_TEXT_DETECTION).build())
                    .setImageContext(context.build())
                    .build();

            BatchAnnotateImagesResponse batchResponse = getOrCreateClient().batchAnnotateImages(List.of(request));
            AnnotateImageResponse response = batchResponse.getResponses(0);
            if (response.hasError()) {
                throw new RecognitionException(response.getError().getMessage());
            }

            if (response.hasFullTextAnnotation()) {
                return response.getFullTextAnnotation().getText();
            }
            if (!response.getTextAnnotationsList().isEmpty()) {
                return response.getTextAnnotationsList().get(0).getDescription();
            }
            return "";
        } catch (ApiException e) {
            throw new RecognitionException(e.getMessage(), e);
        } catch (IOException e) {
            throw new RecognitionException("Failed to create Vision client from " + credentialPath + ": " + e.getMessage(), e);
        }
    }

    static List<String> toLanguageHints(String languageHint) {
        if (languageHint == null || languageHint.isBlank()) {
            return List.of();
        }
        return Arrays.stream(languageHint.split("\\+"))
                .map(String::trim)
                .filter(code -> !code.isEmpty())
                .map(code -> LANGUAGE_HINTS.getOrDefault(code.toLowerCase(Locale.ROOT), code))
                .distinct()
                .toList();
    }

    private ImageAnnotatorClient getOrCreateClient() throws IOException {
        ImageAnnotatorClient existing = client;
        if (existing != null) {
            return existing;
        }
        synchronized (this) {
            if (client == null) {
                GoogleCredentials credentials;
                try (InputStream in = Files.newInputStream(credentialPath)) {
                    credentials = ServiceAccountCredentials.fromStream(in);
                }
                ImageAnnotatorSettings settings = ImageAnnotatorSettings.newBuilder()
                        .setCredentialsProvider(FixedCredentialsProvider.create(credentials))
                        .build();
                client = ImageAnnotatorClient.create(settings);
            }
            return client;
        }
    }

    @Override
    public void close() {
        ImageAnnotatorClient existing = client;
        if (existing != null) {
            existing.close();
        }
    }
}
