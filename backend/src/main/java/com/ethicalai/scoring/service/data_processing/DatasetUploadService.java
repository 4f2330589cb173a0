package com.ethicalai.scoring.service.data_processing;

import java.util.Locale;

import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import com.ethicalai.scoring.config.EthicsProperties;
import com.ethicalai.scoring.exception.UnsupportedFormatException;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/** Checks multipart uploads before any parsing and wraps them as a {@link DatasetSource}. */
@Slf4j
@Service
@RequiredArgsConstructor
public class DatasetUploadService {

  private final EthicsProperties properties;

  public DatasetSource accept(MultipartFile file) {
    validateFile(file);
    log.debug("Accepted upload {} ({} bytes)", file.getOriginalFilename(), file.getSize());
    return DatasetSource.of(file);
  }

  private void validateFile(MultipartFile file) {
    if (file == null || file.isEmpty()) {
      throw new IllegalArgumentException("File is empty");
    }

    long maxFileSize = properties.getUpload().getMaxFileSize();
    if (file.getSize() > maxFileSize) {
      throw new IllegalArgumentException(
          "File size exceeds maximum allowed size of " + maxFileSize + " bytes");
    }

    String fileName = file.getOriginalFilename();
    if (fileName == null || fileName.isEmpty()) {
      throw new IllegalArgumentException("File name is empty");
    }

    String extension = DatasetFormat.extractExtension(fileName).toLowerCase(Locale.ROOT);
    if (!properties.getUpload().getAllowedExtensions().contains(extension)) {
      throw new UnsupportedFormatException(extension);
    }
    DatasetFormat.fromExtension(extension);
  }
}
