package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.geo.Crs;
import com.onthegomap.palmprep.geo.GdalCrs;
import com.onthegomap.palmprep.util.FileUtils;
import java.io.IOException;
import java.nio.file.Path;
import org.gdal.gdal.Band;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.Driver;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconstConstants;

/**
 * Reads and writes GeoTIFF rasters through the GDAL Java bindings.
 * <p>
 * Writes DEFLATE-compressed, tiled Float32 GeoTIFFs. NaN cells are written as {@value #GEOTIFF_NODATA}.
 */
public class GdalRasterIO implements RasterReader, RasterWriter {

  public static final double GEOTIFF_NODATA = -9999;
  private static final String[] CREATE_OPTIONS = {"COMPRESS=DEFLATE", "TILED=YES"};

  public GdalRasterIO() {
    gdal.AllRegister();
  }

  @Override
  public RasterLayer read(Path path) throws IOException {
    Dataset dataset = gdal.Open(path.toString(), gdalconstConstants.GA_ReadOnly);
    if (dataset == null) {
      throw new IOException("GDALOpen failed for " + path + " - " + gdal.GetLastErrorNo() + ": " +
        gdal.GetLastErrorMsg());
    }
    try {
      Crs crs = GdalCrs.fromWkt(dataset.GetProjectionRef(), null, path.toString());
      GridGeometry grid = GridGeometry.fromGeoTransform(crs, dataset.GetGeoTransform(), dataset.GetRasterXSize(),
        dataset.GetRasterYSize());
      Band band = dataset.GetRasterBand(1);
      double[] values = new double[grid.size()];
      int result = band.ReadRaster(0, 0, grid.nx(), grid.ny(), values);
      if (result != gdalconstConstants.CE_None) {
        throw new IOException("Failed to read band 1 of " + path + ": " + gdal.GetLastErrorMsg());
      }
      Double[] nodata = new Double[1];
      band.GetNoDataValue(nodata);
      return new RasterLayer(grid, values, nodata[0] == null ? Double.NaN : nodata[0]);
    } finally {
      dataset.delete();
    }
  }

  @Override
  public void write(RasterLayer raster, Path path) throws IOException {
    FileUtils.createParentDirectories(path);
    GridGeometry grid = raster.grid();
    Driver driver = gdal.GetDriverByName("GTiff");
    Dataset dataset = driver.Create(path.toString(), grid.nx(), grid.ny(), 1, gdalconstConstants.GDT_Float32,
      CREATE_OPTIONS);
    if (dataset == null) {
      throw new IOException("Unable to create " + path + ": " + gdal.GetLastErrorMsg());
    }
    try {
      dataset.SetGeoTransform(grid.geoTransform());
      dataset.SetProjection(GdalCrs.toWkt(grid.crs()));
      double nodata = Double.isNaN(raster.nodata()) ? GEOTIFF_NODATA : raster.nodata();
      double[] values = raster.values();
      for (int i = 0; i < values.length; i++) {
        if (raster.isNoData(values[i])) {
          values[i] = nodata;
        }
      }
      Band band = dataset.GetRasterBand(1);
      band.SetNoDataValue(nodata);
      if (band.WriteRaster(0, 0, grid.nx(), grid.ny(), values) != gdalconstConstants.CE_None) {
        throw new IOException("Failed to write " + path + ": " + gdal.GetLastErrorMsg());
      }
      dataset.FlushCache();
    } finally {
      dataset.delete();
    }
  }
}
