package com.ethicalai.scoring.service.data_processing;

import java.util.List;

import lombok.Value;

/** Header plus rows of raw cell text, every row padded to the header width. */
@Value
public class RawDataset {

  String name;
  List<String> columns;
  List<List<String>> rows;

  public int rowCount() {
    return rows.size();
  }

  public int columnCount() {
    return columns.size();
  }
}
