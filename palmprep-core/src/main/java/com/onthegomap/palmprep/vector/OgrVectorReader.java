package com.onthegomap.palmprep.vector;

import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.GdalCrs;
import com.onthegomap.palmprep.geo.TaggedWkt;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.gdal.ogr.DataSource;
import org.gdal.ogr.Feature;
import org.gdal.ogr.FeatureDefn;
import org.gdal.ogr.Geometry;
import org.gdal.ogr.Layer;
import org.gdal.ogr.ogr;
import org.gdal.ogr.ogrConstants;
import org.gdal.osr.SpatialReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads vector files (CityGML, GeoPackage, GeoJSON, shapefiles, ...) through the OGR Java bindings.
 * <p>
 * Every layer is read in order and merged into one {@link FeatureSet}. Geometries are exported as ISO WKT so surface
 * types keep their tag.
 */
public class OgrVectorReader implements VectorReader {

  private static final Logger LOGGER = LoggerFactory.getLogger(OgrVectorReader.class);

  private final Crs defaultCrs;

  /**
   * @param defaultCrs CRS to assume when a file does not declare one, or null to fail instead
   */
  public OgrVectorReader(Crs defaultCrs) {
    ogr.RegisterAll();
    this.defaultCrs = defaultCrs;
  }

  @Override
  public FeatureSet read(Path path) throws IOException {
    DataSource dataSource = ogr.Open(path.toString(), 0);
    if (dataSource == null) {
      throw new IOException("OGROpen failed for " + path);
    }
    try {
      Crs crs = null;
      List<VectorFeature> features = new ArrayList<>();
      for (int i = 0; i < dataSource.GetLayerCount(); i++) {
        Layer layer = dataSource.GetLayer(i);
        Crs layerCrs = layerCrs(layer, path);
        if (crs == null) {
          crs = layerCrs;
        } else if (!crs.equals(layerCrs)) {
          LOGGER.warn("Skipping layer {} of {} in {}, expected {}", layer.GetName(), path, layerCrs, crs);
          continue;
        }
        readLayer(layer, features);
      }
      if (crs == null) {
        crs = GdalCrs.fromWkt(null, defaultCrs, path.toString());
      }
      LOGGER.debug("Read {} features from {}", features.size(), path);
      return new FeatureSet(crs, features);
    } finally {
      dataSource.delete();
    }
  }

  private Crs layerCrs(Layer layer, Path path) {
    SpatialReference srs = layer.GetSpatialRef();
    return GdalCrs.fromWkt(srs == null ? null : srs.ExportToWkt(), defaultCrs, path.toString());
  }

  private static void readLayer(Layer layer, List<VectorFeature> features) throws IOException {
    FeatureDefn definition = layer.GetLayerDefn();
    layer.ResetReading();
    Feature feature;
    while ((feature = layer.GetNextFeature()) != null) {
      try {
        Map<String, Object> attributes = new LinkedHashMap<>();
        for (int f = 0; f < definition.GetFieldCount(); f++) {
          String name = definition.GetFieldDefn(f).GetName();
          attributes.put(name, fieldValue(feature, f, definition.GetFieldDefn(f).GetFieldType()));
        }
        Geometry geometry = feature.GetGeometryRef();
        features.add(new VectorFeature(TaggedWkt.parse(isoWkt(geometry)), attributes));
      } finally {
        feature.delete();
      }
    }
  }

  private static String isoWkt(Geometry geometry) throws IOException {
    if (geometry == null) {
      return null;
    }
    String[] wkt = new String[1];
    int error = geometry.ExportToIsoWkt(wkt);
    if (error != ogrConstants.OGRERR_NONE) {
      throw new IOException("OGR error " + error + " exporting " + geometry.GetGeometryName() + " as WKT");
    }
    return wkt[0];
  }

  private static Object fieldValue(Feature feature, int index, int type) {
    if (!feature.IsFieldSetAndNotNull(index)) {
      return null;
    }
    if (type == ogrConstants.OFTInteger || type == ogrConstants.OFTInteger64) {
      return feature.GetFieldAsInteger64(index);
    } else if (type == ogrConstants.OFTReal) {
      return feature.GetFieldAsDouble(index);
    }
    return feature.GetFieldAsString(index);
  }
}
