package com.onthegomap.palmprep.raster;

import com.onthegomap.palmprep.geo.GdalCrs;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Vector;
import org.gdal.gdal.Dataset;
import org.gdal.gdal.Driver;
import org.gdal.gdal.WarpOptions;
import org.gdal.gdal.gdal;
import org.gdal.gdalconst.gdalconstConstants;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Warps rasters with {@code gdal.Warp} through in-memory GDAL datasets.
 * <p>
 * gdalwarp lets later inputs overwrite earlier ones, so sources are handed to it in reverse order to keep the first
 * valid value.
 */
public class GdalRasterWarper implements RasterWarper {

  private static final Logger LOGGER = LoggerFactory.getLogger(GdalRasterWarper.class);

  public GdalRasterWarper() {
    gdal.AllRegister();
  }

  @Override
  public RasterLayer warp(List<RasterLayer> sources, GridGeometry target, Resampling resampling) {
    if (sources.isEmpty()) {
      throw new IllegalArgumentException("Nothing to warp");
    }
    double nodata = sources.get(0).nodata();
    Driver driver = gdal.GetDriverByName("MEM");
    List<Dataset> inputs = new ArrayList<>();
    Dataset output = null;
    try {
      for (int i = sources.size() - 1; i >= 0; i--) {
        RasterLayer source = sources.get(i);
        inputs.add(toDataset(driver, source.grid(), source.values(), source.nodata()));
      }
      output = toDataset(driver, target, filled(target.size(), nodata), nodata);
      LOGGER.debug("gdal.Warp {} sources onto {}x{} grid with {}", sources.size(), target.nx(), target.ny(),
        resampling);
      int result = gdal.Warp(output, inputs.toArray(Dataset[]::new), new WarpOptions(warpOptions(resampling, nodata)));
      if (result != 1) {
        throw new IllegalStateException("GDALWarp failed - " + gdal.GetLastErrorNo() + ": " + gdal.GetLastErrorMsg());
      }
      double[] values = new double[target.size()];
      if (output.GetRasterBand(1).ReadRaster(0, 0, target.nx(), target.ny(), values) != gdalconstConstants.CE_None) {
        throw new IllegalStateException("Failed to read warped raster: " + gdal.GetLastErrorMsg());
      }
      return new RasterLayer(target, values, nodata);
    } finally {
      inputs.forEach(Dataset::delete);
      if (output != null) {
        output.delete();
      }
    }
  }

  static Vector<String> warpOptions(Resampling resampling, double nodata) {
    return new Vector<>(List.of("-r", resampling.gdalName(), "-dstnodata", gdalNoData(nodata)));
  }

  static String gdalNoData(double nodata) {
    return Double.isNaN(nodata) ? "nan" : Double.toString(nodata);
  }

  private static double[] filled(int size, double value) {
    double[] values = new double[size];
    Arrays.fill(values, value);
    return values;
  }

  private static Dataset toDataset(Driver driver, GridGeometry grid, double[] values, double nodata) {
    Dataset dataset = driver.Create("", grid.nx(), grid.ny(), 1, gdalconstConstants.GDT_Float64);
    if (dataset == null) {
      throw new IllegalStateException("Unable to create in-memory raster: " + gdal.GetLastErrorMsg());
    }
    dataset.SetGeoTransform(grid.geoTransform());
    dataset.SetProjection(GdalCrs.toWkt(grid.crs()));
    var band = dataset.GetRasterBand(1);
    band.SetNoDataValue(nodata);
    if (band.WriteRaster(0, 0, grid.nx(), grid.ny(), values) != gdalconstConstants.CE_None) {
      dataset.delete();
      throw new IllegalStateException("Unable to fill in-memory raster: " + gdal.GetLastErrorMsg());
    }
    return dataset;
  }
}
