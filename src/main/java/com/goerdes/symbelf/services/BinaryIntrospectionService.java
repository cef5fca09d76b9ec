package com.goerdes.symbelf.services;

import com.goerdes.symbelf.components.BinaryFactory;
import com.goerdes.symbelf.components.SymbolSelectionFilter;
import com.goerdes.symbelf.components.WarningRegistry;
import com.goerdes.symbelf.exception.FileProcessingException;
import com.goerdes.symbelf.model.Binary;
import com.goerdes.symbelf.model.BinaryOverview;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Builds symbol models of uploaded binaries.
 */
@Service
@RequiredArgsConstructor
public class BinaryIntrospectionService {

    private static final Logger log = LoggerFactory.getLogger(BinaryIntrospectionService.class);

    private final BinaryFactory binaryFactory;

    /**
     * Models the uploaded binary with the configured symbol selection.
     *
     * @param upload the binary received via API
     * @return overview of the model including the warnings of this run
     * @throws FileProcessingException if the upload cannot be stored or the binary not be modelled
     */
    public BinaryOverview introspect(MultipartFile upload) {
        return introspect(upload, binaryFactory.getSelectionFilter());
    }

    /**
     * Models the uploaded binary, keeping only symbols accepted by {@code selection}.
     */
    public BinaryOverview introspect(MultipartFile upload, SymbolSelectionFilter selection) {
        String filename = upload.getOriginalFilename();
        if (filename == null || filename.isBlank()) {
            throw new FileProcessingException("Missing original filename", null);
        }
        Path baseName = Path.of(filename).getFileName();
        if (baseName == null) {
            throw new FileProcessingException("Invalid original filename " + filename, null);
        }
        log.info("Introspecting: {}", filename);

        Path tmpDir = null;
        try {
            tmpDir = Files.createTempDirectory("symbelf-");
            Path tmpFile = tmpDir.resolve(baseName.toString());
            upload.transferTo(tmpFile);

            WarningRegistry warnings = new WarningRegistry();
            Binary binary = binaryFactory.create(tmpFile.toString(), selection, warnings);
            if (warnings.hasWarnings()) {
                log.info("Introspection of {} finished with {} warnings", filename, warnings.getWarnings().size());
            }
            return BinaryOverview.of(binary, filename, warnings.getWarnings());
        } catch (IOException e) {
            throw new FileProcessingException("I/O error while storing " + filename + ": " + e.getMessage(), e);
        } finally {
            deleteRecursively(tmpDir);
        }
    }

    private static void deleteRecursively(Path dir) {
        if (dir == null) {
            return;
        }
        try (Stream<Path> paths = Files.walk(dir)) {
            paths.sorted(Comparator.reverseOrder()).forEach(p -> {
                try {
                    Files.deleteIfExists(p);
                } catch (IOException e) {
                    log.warn("Unable to delete temporary file {}: {}", p, e.getMessage());
                }
            });
        } catch (IOException e) {
            log.warn("Unable to clean up temporary directory {}: {}", dir, e.getMessage());
        }
    }
}
