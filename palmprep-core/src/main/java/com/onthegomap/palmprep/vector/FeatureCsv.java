package com.onthegomap.palmprep.vector;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.SourceGeometry;
import com.onthegomap.palmprep.geo.TaggedWkt;
import com.onthegomap.palmprep.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads and writes a {@link FeatureSet} as CSV with the geometry in a {@value #GEOMETRY_COLUMN} column.
 * <p>
 * This is the layout {@code ogr2ogr -f CSV -lco GEOMETRY=AS_WKT} produces, so the same file can be handed to OGR and
 * read back. Attribute values come back as strings, and empty cells come back as null.
 */
public class FeatureCsv {

  public static final String GEOMETRY_COLUMN = "WKT";
  private static final CsvMapper MAPPER = new CsvMapper();

  private FeatureCsv() {}

  public static void write(FeatureSet features, Path path) throws IOException {
    FileUtils.createParentDirectories(path);
    CsvSchema.Builder schema = CsvSchema.builder().addColumn(GEOMETRY_COLUMN);
    for (String column : features.columns()) {
      if (!GEOMETRY_COLUMN.equalsIgnoreCase(column)) {
        schema.addColumn(column);
      }
    }
    try (var writer = MAPPER.writerFor(Map.class).with(schema.build().withHeader()).writeValues(path.toFile())) {
      for (VectorFeature feature : features.features()) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(GEOMETRY_COLUMN, TaggedWkt.write(feature.geometry()));
        feature.attributes().forEach((key, value) -> {
          if (!GEOMETRY_COLUMN.equalsIgnoreCase(key)) {
            row.put(key, value == null ? "" : value.toString());
          }
        });
        writer.write(row);
      }
    }
  }

  /** Reads the features in {@code path}, which are assumed to be in {@code crs}. */
  public static FeatureSet read(Path path, Crs crs) throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    List<VectorFeature> features = new ArrayList<>();
    try (MappingIterator<Map<String, String>> rows = MAPPER.readerFor(Map.class).with(schema)
      .readValues(path.toFile())) {
      while (rows.hasNext()) {
        Map<String, String> row = rows.next();
        String wkt = null;
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (var entry : row.entrySet()) {
          if (GEOMETRY_COLUMN.equalsIgnoreCase(entry.getKey())) {
            wkt = entry.getValue();
          } else {
            String value = entry.getValue();
            attributes.put(entry.getKey(), value == null || value.isEmpty() ? null : value);
          }
        }
        SourceGeometry geometry = TaggedWkt.parse(wkt);
        features.add(new VectorFeature(geometry, attributes));
      }
    }
    return new FeatureSet(crs, features);
  }
}
