package com.whereq.transcribe.resource;

import com.whereq.transcribe.config.TranscribeProperties;
import com.whereq.transcribe.exception.ResourceNotFoundException;
import com.whereq.transcribe.model.ResourceRef;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Resources stored as files below a configured directory. The resource id is the
 * file's path relative to that directory.
 */
@Slf4j
@Component
public class FileSystemResourceStore implements ResourceStore {

    private final Path root;
    private final String defaultMimeType;

    public FileSystemResourceStore(TranscribeProperties properties) {
        this.root = properties.getResources().getDirectory().toAbsolutePath().normalize();
        this.defaultMimeType = properties.getResources().getDefaultMimeType();
    }

    @Override
    public Mono<ResourceRef> describe(String resourceId) {
        return Mono.fromCallable(() -> {
            Path file = resolve(resourceId);
            if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
                throw new ResourceNotFoundException("Resource not found: " + resourceId);
            }
            return ResourceRef.builder()
                .resourceId(resourceId)
                .sizeBytes(Files.size(file))
                .mimeType(detectMimeType(file))
                .build();
        })
        .onErrorMap(IOException.class, e -> new ResourceNotFoundException("Resource unreadable: " + resourceId, e))
        .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public Mono<byte[]> load(ResourceRef resource) {
        return Mono.fromCallable(() -> Files.readAllBytes(resolve(resource.getResourceId())))
            .onErrorMap(IOException.class, e -> new ResourceNotFoundException(
                "Resource unreadable: " + resource.getResourceId(), e))
            .doOnSuccess(bytes -> log.debug("Loaded resource {} ({} bytes)", resource.getResourceId(), bytes.length))
            .subscribeOn(Schedulers.boundedElastic());
    }

    private Path resolve(String resourceId) {
        if (resourceId == null || resourceId.isBlank()) {
            throw new ResourceNotFoundException("Resource id is missing");
        }
        Path file = root.resolve(resourceId).normalize();
        if (!file.startsWith(root)) {
            throw new ResourceNotFoundException("Resource id escapes the resource directory: " + resourceId);
        }
        return file;
    }

    private String detectMimeType(Path file) throws IOException {
        String probed = Files.probeContentType(file);
        return probed != null ? probed : defaultMimeType;
    }
}
