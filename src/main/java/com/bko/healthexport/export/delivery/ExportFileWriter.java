package com.bko.healthexport.export.delivery;

import com.bko.healthexport.export.ExportDocument;
import com.bko.healthexport.shared.AppSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

@Component
public class ExportFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(ExportFileWriter.class);

    private final AppSettings settings;

    public ExportFileWriter(AppSettings settings) {
        this.settings = settings;
    }

    public Path write(ExportDocument document) throws IOException {
        Path directory = settings.export().outputPath();
        Files.createDirectories(directory);
        Path target = directory.resolve(document.filename());
        Path temporary = Files.createTempFile(directory, ".export-", ".tmp");
        try {
            Files.write(temporary, document.content());
            Files.move(temporary, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            Files.deleteIfExists(temporary);
            throw e;
        }
        logger.info("Wrote {}", target);
        return target;
    }
}
