package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.api.geom.Coord;
import io.kifmt.parser.api.geom.Position;
import io.kifmt.parser.api.model.Flag;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Property;
import io.kifmt.parser.api.model.UuidRef;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * A footprint, either a standalone {@code .kicad_mod} document or placed on a {@link Board}.
 *
 * <p>Files from KiCad 5 and earlier use {@code module} as the root token; {@link #getRootToken()}
 * keeps it so the file is written back the same way. The header fields inherited from {@link
 * KiCadDocument} are only used by standalone footprints.
 */
public class Footprint extends KiCadDocument {
  public static final String ROOT = "footprint";
  public static final String LEGACY_ROOT = "module";

  private String rootToken;
  private String name;
  private Flag locked;
  private Flag placed;
  private String layer;
  private String tedit;
  private UuidRef uuid;
  private Position position;
  private String description;
  private String tags;
  private final List<Property> properties = new ArrayList<>();
  private String path;
  private String sheetName;
  private String sheetFile;
  private List<String> attributes;
  private Coord clearance;
  private Coord solderMaskMargin;
  private Coord solderPasteMargin;
  private Double solderPasteRatio;
  private Integer zoneConnectCode;
  private final List<Graphic> graphics = new ArrayList<>();
  private final List<PcbText> texts = new ArrayList<>();
  private final List<Pad> pads = new ArrayList<>();
  private final List<Zone> zones = new ArrayList<>();
  private final List<Model3D> models = new ArrayList<>();

  public Footprint(String name) {
    this(ROOT, name);
  }

  public Footprint(String rootToken, String name) {
    this.rootToken = Objects.requireNonNull(rootToken, "rootToken");
    this.name = Objects.requireNonNull(name, "name");
  }

  /** @return {@code footprint} or the legacy {@code module} */
  public String getRootToken() {
    return rootToken;
  }

  public void setRootToken(String rootToken) {
    this.rootToken = rootToken;
  }

  /** @return the library identifier, such as {@code Resistor_SMD:R_0805} */
  public String getName() {
    return name;
  }

  public void setName(String name) {
    this.name = name;
  }

  public Flag getLocked() {
    return locked;
  }

  public void setLocked(Flag locked) {
    this.locked = locked;
  }

  public Flag getPlaced() {
    return placed;
  }

  public void setPlaced(Flag placed) {
    this.placed = placed;
  }

  public String getLayer() {
    return layer;
  }

  public void setLayer(String layer) {
    this.layer = layer;
  }

  /** @return the legacy edit timestamp, {@code (tedit 5F1A...)}; null if absent */
  public String getTedit() {
    return tedit;
  }

  public void setTedit(String tedit) {
    this.tedit = tedit;
  }

  public UuidRef getUuid() {
    return uuid;
  }

  public void setUuid(UuidRef uuid) {
    this.uuid = uuid;
  }

  public Position getPosition() {
    return position;
  }

  public void setPosition(Position position) {
    this.position = position;
  }

  public String getDescription() {
    return description;
  }

  public void setDescription(String description) {
    this.description = description;
  }

  public String getTags() {
    return tags;
  }

  public void setTags(String tags) {
    this.tags = tags;
  }

  public List<Property> getProperties() {
    return properties;
  }

  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = path;
  }

  public String getSheetName() {
    return sheetName;
  }

  public void setSheetName(String sheetName) {
    this.sheetName = sheetName;
  }

  public String getSheetFile() {
    return sheetFile;
  }

  public void setSheetFile(String sheetFile) {
    this.sheetFile = sheetFile;
  }

  /** @return the {@code (attr ...)} words such as {@code smd}; null if absent */
  public List<String> getAttributes() {
    return attributes;
  }

  public void setAttributes(List<String> attributes) {
    this.attributes = attributes;
  }

  public Coord getClearance() {
    return clearance;
  }

  public void setClearance(Coord clearance) {
    this.clearance = clearance;
  }

  public Coord getSolderMaskMargin() {
    return solderMaskMargin;
  }

  public void setSolderMaskMargin(Coord solderMaskMargin) {
    this.solderMaskMargin = solderMaskMargin;
  }

  public Coord getSolderPasteMargin() {
    return solderPasteMargin;
  }

  public void setSolderPasteMargin(Coord solderPasteMargin) {
    this.solderPasteMargin = solderPasteMargin;
  }

  public Double getSolderPasteRatio() {
    return solderPasteRatio;
  }

  public void setSolderPasteRatio(Double solderPasteRatio) {
    this.solderPasteRatio = solderPasteRatio;
  }

  public Integer getZoneConnectCode() {
    return zoneConnectCode;
  }

  public void setZoneConnectCode(Integer zoneConnectCode) {
    this.zoneConnectCode = zoneConnectCode;
  }

  public List<Graphic> getGraphics() {
    return graphics;
  }

  public List<PcbText> getTexts() {
    return texts;
  }

  public List<Pad> getPads() {
    return pads;
  }

  public List<Zone> getZones() {
    return zones;
  }

  public List<Model3D> getModels() {
    return models;
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.FOOTPRINT;
  }

  public boolean isLegacy() {
    return LEGACY_ROOT.equals(rootToken);
  }

  public boolean isLocked() {
    return Flag.isSet(locked);
  }

  /**
   * Finds a property by name.
   *
   * @param propertyName the property name, such as {@code Reference}
   * @return the first matching property
   */
  public Optional<Property> property(String propertyName) {
    return properties.stream().filter(p -> p.getName().equals(propertyName)).findFirst();
  }

  /**
   * Returns the reference designator, from the {@code Reference} property or, in older files, the
   * {@code fp_text reference} entry.
   *
   * @return the reference, if any
   */
  public Optional<String> reference() {
    return textOf("Reference", "reference");
  }

  public Optional<String> value() {
    return textOf("Value", "value");
  }

  private Optional<String> textOf(String propertyName, String textKind) {
    Optional<Property> p = property(propertyName);
    if (p.isPresent()) {
      return Optional.of(p.get().getValue());
    }
    return texts.stream()
        .filter(t -> textKind.equals(t.getKind()))
        .map(PcbText::getText)
        .findFirst();
  }

  /**
   * Finds pads by number. Several pads may share a number.
   *
   * @param number the pad number
   * @return the matching pads in file order
   */
  public List<Pad> padsNumbered(String number) {
    List<Pad> result = new ArrayList<>();
    for (Pad pad : pads) {
      if (pad.getNumber().equals(number)) {
        result.add(pad);
      }
    }
    return result;
  }

  @Override
  public String toString() {
    return "Footprint{" + name + ", " + pads.size() + " pads}";
  }
}
