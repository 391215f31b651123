package com.whereq.transcribe.artifact;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.ArtifactCreationException;
import com.whereq.transcribe.model.ArtifactRef;
import com.whereq.transcribe.model.TranscriptionJob;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * Writes transcript documents as Markdown files grouped by correlation reference:
 * {@code <directory>/<correlationRef>/<jobId>.md}.
 */
@Slf4j
@Component
public class FileSystemArtifactStore implements ArtifactStore {

    private final Path root;
    private final String publicBaseUrl;

    public FileSystemArtifactStore(TranscribeProperties properties) {
        this.root = properties.getArtifacts().getDirectory().toAbsolutePath().normalize();
        this.publicBaseUrl = properties.getArtifacts().getPublicBaseUrl();
    }

    @Override
    public Mono<ArtifactRef> createDocument(TranscriptionJob job, String content) {
        return Mono.fromCallable(() -> write(job, content))
            .onErrorMap(e -> !(e instanceof ArtifactCreationException),
                e -> new ArtifactCreationException("Failed to create transcript document for job "
                    + job.getJobId() + ": " + e.getMessage(), e))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private ArtifactRef write(TranscriptionJob job, String content) throws IOException {
        String folder = safeName(job.getCorrelationRef());
        String fileName = safeName(job.getJobId()) + ".md";
        Path directory = root.resolve(folder);
        Path target = directory.resolve(fileName);

        Files.createDirectories(directory);
        Path temp = Files.createTempFile(directory, fileName, ".tmp");
        try {
            Files.writeString(temp, content, StandardCharsets.UTF_8);
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } finally {
            Files.deleteIfExists(temp);
        }

        log.info("Wrote transcript document {} for {}", target, job.getCorrelationRef());

        return ArtifactRef.builder()
            .artifactId(folder + "/" + fileName)
            .location(location(folder, fileName, target))
            .correlationRef(job.getCorrelationRef())
            .build();
    }

    private String location(String folder, String fileName, Path target) {
        if (publicBaseUrl == null || publicBaseUrl.isBlank()) {
            return target.toUri().toString();
        }
        String base = publicBaseUrl.endsWith("/") ? publicBaseUrl : publicBaseUrl + "/";
        return base + folder + "/" + fileName;
    }

    private static String safeName(String value) {
        if (value == null || value.isBlank()) {
            throw new ArtifactCreationException("Document name component is missing");
        }
        return value.replaceAll("[^A-Za-z0-9._-]", "_").replaceAll("^\\.+", "_");
    }
}
