package com.ethicalai.scoring.dto.fingerprint;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@JsonInclude(JsonInclude.Include.NON_NULL)
@Schema(description = "Content identity of an analyzed dataset")
public class Fingerprint {

  @Schema(description = "Hex-encoded digest of the raw file bytes")
  @JsonProperty("file_hash")
  String fileHash;

  @JsonProperty("algorithm")
  String algorithm;

  @Schema(description = "Size in MiB rounded to two decimals")
  @JsonProperty("file_size_mb")
  double fileSizeMb;

  @JsonProperty("file_size_bytes")
  long fileSizeBytes;

  @JsonProperty("rows")
  int rows;

  @JsonProperty("columns")
  int columns;

  @JsonProperty("file_name")
  String fileName;

  @JsonProperty("generated_at")
  Instant generatedAt;
}
