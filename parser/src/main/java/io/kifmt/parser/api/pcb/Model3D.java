package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.model.Element;
import io.kifmt.parser.api.model.Flag;
import java.util.Objects;

/** A 3D model reference with its offset, scale and rotation triples. */
public class Model3D extends Element {
  private String path;
  private double[] offset;
  private double[] scale;
  private double[] rotate;
  private Flag hide;
  private Double opacity;

  public Model3D(String path) {
    this.path = Objects.requireNonNull(path, "path");
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public double[] getOffset() {
    return offset;
  }

  public void setOffset(double[] offset) {
    this.offset = offset;
  }

  public double[] getScale() {
    return scale;
  }

  public void setScale(double[] scale) {
    this.scale = scale;
  }

  public double[] getRotate() {
    return rotate;
  }

  public void setRotate(double[] rotate) {
    this.rotate = rotate;
  }

  public Flag getHide() {
    return hide;
  }

  public void setHide(Flag hide) {
    this.hide = hide;
  }

  public Double getOpacity() {
    return opacity;
  }

  public void setOpacity(Double opacity) {
    this.opacity = opacity;
  }
}
