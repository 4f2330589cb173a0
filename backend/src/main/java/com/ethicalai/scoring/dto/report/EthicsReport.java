package com.ethicalai.scoring.dto.report;

import java.time.Instant;

import com.ethicalai.scoring.dto.bias.BiasReport;
import com.ethicalai.scoring.dto.dataset.DatasetProfile;
import com.ethicalai.scoring.dto.fingerprint.Fingerprint;
import com.fasterxml.jackson.annotation.JsonProperty;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

@Value
@Builder
@Jacksonized
@Schema(description = "Everything the report and badge renderers need for one assessment")
public class EthicsReport {

  @JsonProperty("report_id")
  String reportId;

  @JsonProperty("dataset_name")
  String datasetName;

  @JsonProperty("generated_at")
  Instant generatedAt;

  @JsonProperty("composite_report")
  CompositeReport compositeReport;

  @JsonProperty("bias_report")
  BiasReport biasReport;

  @JsonProperty("fingerprint")
  Fingerprint fingerprint;

  @JsonProperty("dataset_profile")
  DatasetProfile datasetProfile;
}
