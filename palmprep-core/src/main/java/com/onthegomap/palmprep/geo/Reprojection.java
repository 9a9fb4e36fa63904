package com.onthegomap.palmprep.geo;

import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateXY;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.impl.PackedCoordinateSequence;
import org.locationtech.jts.geom.util.GeometryTransformer;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;

/**
 * Transforms coordinates, geometries and envelopes from one {@link Crs} to another.
 * <p>
 * Instances are not thread-safe.
 */
public class Reprojection {

  private static final CoordinateTransformFactory FACTORY = new CoordinateTransformFactory();
  private static final int ENVELOPE_SAMPLES_PER_EDGE = 20;

  private final CoordinateTransform transform;
  private final ProjCoordinate in = new ProjCoordinate();
  private final ProjCoordinate out = new ProjCoordinate();

  private Reprojection(Crs from, Crs to) {
    this.transform = from.equals(to) ? null : FACTORY.createTransform(from.definition(), to.definition());
  }

  public static Reprojection between(Crs from, Crs to) {
    return new Reprojection(from, to);
  }

  /** Returns {@code (x, y)} in the target CRS. */
  public CoordinateXY transform(double x, double y) {
    if (transform == null) {
      return new CoordinateXY(x, y);
    }
    in.x = x;
    in.y = y;
    transform.transform(in, out);
    return new CoordinateXY(out.x, out.y);
  }

  /** Returns a 2D copy of {@code geometry} in the target CRS. */
  public Geometry transform(Geometry geometry) {
    if (transform == null || geometry == null) {
      return geometry;
    }
    return new GeometryTransformer() {
      @Override
      protected CoordinateSequence transformCoordinates(CoordinateSequence coords, Geometry parent) {
        CoordinateSequence copy = new PackedCoordinateSequence.Double(coords.size(), 2, 0);
        for (int i = 0; i < coords.size(); i++) {
          var transformed = Reprojection.this.transform(coords.getX(i), coords.getY(i));
          copy.setOrdinate(i, 0, transformed.x);
          copy.setOrdinate(i, 1, transformed.y);
        }
        return copy;
      }
    }.transform(geometry);
  }

  /** Returns the envelope that contains {@code envelope} after it is transformed, sampling points along each edge. */
  public Envelope transform(Envelope envelope) {
    if (transform == null) {
      return new Envelope(envelope);
    }
    Envelope result = new Envelope();
    for (int i = 0; i <= ENVELOPE_SAMPLES_PER_EDGE; i++) {
      double fx = envelope.getMinX() + envelope.getWidth() * i / ENVELOPE_SAMPLES_PER_EDGE;
      double fy = envelope.getMinY() + envelope.getHeight() * i / ENVELOPE_SAMPLES_PER_EDGE;
      result.expandToInclude(transform(fx, envelope.getMinY()));
      result.expandToInclude(transform(fx, envelope.getMaxY()));
      result.expandToInclude(transform(envelope.getMinX(), fy));
      result.expandToInclude(transform(envelope.getMaxX(), fy));
    }
    return result;
  }
}
