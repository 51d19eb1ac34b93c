package org.mides.pooling.data;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.mides.pooling.model.RideRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/** Saves a prepared request list so later runs can skip reading and filtering the raw records. */
public class RequestCheckpointStore {

    private static final Logger logger = LoggerFactory.getLogger(RequestCheckpointStore.class);

    private final ObjectMapper objectMapper;

    public RequestCheckpointStore(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public boolean exists(Path path) {
        return Files.isRegularFile(path);
    }

    public void save(Path path, List<RideRequest> requests) {
        try {
            if (path.getParent() != null)
                Files.createDirectories(path.getParent());
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(path.toFile(), requests);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to save request checkpoint " + path, e);
        }
        logger.info("Saved {} requests to {}", requests.size(), path);
    }

    public List<RideRequest> load(Path path) {
        List<RideRequest> requests;
        try {
            requests = objectMapper.readValue(path.toFile(), new TypeReference<List<RideRequest>>() { });
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load request checkpoint " + path, e);
        }
        logger.info("Loaded {} requests from {}", requests.size(), path);
        return requests;
    }
}
