package com.ethicalai.scoring.service.data_processing;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;

import org.springframework.web.multipart.MultipartFile;

import com.google.common.io.ByteSource;
import com.google.common.io.Files;

import lombok.Value;

/**
 * A named, re-readable dataset. The content is opened once for parsing and once more for hashing,
 * so large uploads are never copied into a second buffer.
 */
@Value
public class DatasetSource {

  String name;
  ByteSource content;

  public DatasetFormat format() {
    return DatasetFormat.fromFileName(name);
  }

  public static DatasetSource of(String name, byte[] bytes) {
    return new DatasetSource(name, ByteSource.wrap(bytes));
  }

  public static DatasetSource of(Path path) {
    return new DatasetSource(path.getFileName().toString(), Files.asByteSource(path.toFile()));
  }

  public static DatasetSource of(MultipartFile file) {
    return new DatasetSource(
        file.getOriginalFilename(),
        new ByteSource() {
          @Override
          public InputStream openStream() throws IOException {
            return file.getInputStream();
          }
        });
  }
}
