package io.kifmt.parser.api.pcb;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadDocument;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.model.Paper;
import io.kifmt.parser.api.model.TitleBlock;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * A printed circuit board, {@code .kicad_pcb}.
 *
 * <p>Board-wide settings ({@code general}, {@code setup}, plot parameters), groups, dimensions and
 * embedded files are not modeled; they stay in {@link #getRawChildren()} and are written back
 * unchanged.
 */
public class Board extends KiCadDocument {
  private Paper paper;
  private TitleBlock titleBlock;
  private final List<LayerDefinition> layers = new ArrayList<>();
  private final List<Net> nets = new ArrayList<>();
  private final List<NetClass> netClasses = new ArrayList<>();
  private final List<Footprint> footprints = new ArrayList<>();
  private final List<Graphic> graphics = new ArrayList<>();
  private final List<PcbText> texts = new ArrayList<>();
  private final List<Track> tracks = new ArrayList<>();
  private final List<TrackArc> arcs = new ArrayList<>();
  private final List<Via> vias = new ArrayList<>();
  private final List<Zone> zones = new ArrayList<>();

  public Paper getPaper() {
    return paper;
  }

  public void setPaper(Paper paper) {
    this.paper = paper;
  }

  public TitleBlock getTitleBlock() {
    return titleBlock;
  }

  public void setTitleBlock(TitleBlock titleBlock) {
    this.titleBlock = titleBlock;
  }

  public List<LayerDefinition> getLayers() {
    return layers;
  }

  public List<Net> getNets() {
    return nets;
  }

  public List<NetClass> getNetClasses() {
    return netClasses;
  }

  public List<Footprint> getFootprints() {
    return footprints;
  }

  public List<Graphic> getGraphics() {
    return graphics;
  }

  public List<PcbText> getTexts() {
    return texts;
  }

  public List<Track> getTracks() {
    return tracks;
  }

  public List<TrackArc> getArcs() {
    return arcs;
  }

  public List<Via> getVias() {
    return vias;
  }

  public List<Zone> getZones() {
    return zones;
  }

  @Override
  public DocumentKind kind() {
    return DocumentKind.BOARD;
  }

  /** @return every pad of every footprint, in file order */
  public List<Pad> allPads() {
    List<Pad> pads = new ArrayList<>();
    for (Footprint footprint : footprints) {
      pads.addAll(footprint.getPads());
    }
    return pads;
  }

  public Optional<Net> net(int number) {
    return nets.stream().filter(n -> n.getNumber() == number).findFirst();
  }

  public Optional<Footprint> footprintByReference(String reference) {
    return footprints.stream()
        .filter(f -> f.reference().map(reference::equals).orElse(false))
        .findFirst();
  }
}
