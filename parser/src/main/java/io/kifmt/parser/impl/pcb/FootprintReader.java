package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.KiCadFileException;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.pcb.Model3D;
import io.kifmt.parser.impl.DocumentReader;
import io.kifmt.parser.impl.GraphicReader;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.impl.PropertyReader;
import io.kifmt.parser.internal_api.Decoders;
import io.kifmt.parser.internal_api.DispatchTable;
import io.kifmt.parser.internal_api.NodeCursor;
import io.kifmt.parser.internal_api.ReadContext;
import io.kifmt.sexpr.Node;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Reads {@code .kicad_mod} files and the footprints placed on a board. Both the current {@code
 * footprint} root and the legacy {@code module} root are accepted.
 */
public final class FootprintReader implements DocumentReader<Footprint> {
  /** Newest footprint format version this reader was written for. */
  public static final int MAX_VERSION = 20250114;

  private static final DispatchTable<Footprint> TABLE = table();

  private static DispatchTable<Footprint> table() {
    DispatchTable<Footprint> table =
        new DispatchTable<Footprint>()
            .on("property", PropertyReader::read, (fp, p) -> fp.getProperties().add(p))
            .on("fp_text", PcbTextReader::read, (fp, t) -> fp.getTexts().add(t))
            .on("pad", PadReader::read, (fp, pad) -> fp.getPads().add(pad))
            .on("zone", ZoneReader::read, (fp, z) -> fp.getZones().add(z))
            .on("model", FootprintReader::model, (fp, m) -> fp.getModels().add(m))
            .raw(
                "teardrop",
                "net_tie_pad_groups",
                "private_layers",
                "group",
                "dimension",
                "component_classes",
                "embedded_files",
                "embedded_fonts",
                "solder_paste_margin_ratio",
                "autoplace_cost90",
                "autoplace_cost180",
                "thermal_width",
                "thermal_gap",
                "duplicate_pad_numbers_are_jumpers",
                "jumper_pad_groups",
                "fp_text_box",
                "fp_text_private",
                "image",
                "table",
                "units",
                "point");
    return GraphicReader.registerBoardShapes(table, "fp_", (fp, g) -> fp.getGraphics().add(g));
  }

  @Override
  public Footprint read(Node root, ReadContext ctx) throws KiCadFileException {
    Headers.checkRoot(root, DocumentKind.FOOTPRINT, ctx);
    return readFootprint(root, ctx);
  }

  /** Reads a footprint node, standalone or placed on a board. */
  public static Footprint readFootprint(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Footprint fp = new Footprint(node.token(), c.requireText(0, "footprint name"));
    fp.setLocked(c.flag("locked"));
    fp.setPlaced(c.flag("placed"));
    Headers.read(c, fp, MAX_VERSION);
    c.childText("layer").ifPresent(fp::setLayer);
    c.childText("tedit").ifPresent(fp::setTedit);
    c.uuid().ifPresent(fp::setUuid);
    c.position().ifPresent(fp::setPosition);
    c.childText("descr").ifPresent(fp::setDescription);
    c.childText("tags").ifPresent(fp::setTags);
    c.childText("path").ifPresent(fp::setPath);
    c.childText("sheetname").ifPresent(fp::setSheetName);
    c.childText("sheetfile").ifPresent(fp::setSheetFile);
    c.childIf("attr", n -> n.childCount() == 0)
        .ifPresent(
            n -> {
              List<String> attributes = new ArrayList<>();
              n.values().forEach(v -> attributes.add(v.text()));
              fp.setAttributes(attributes);
            });
    c.childCoord("clearance").ifPresent(fp::setClearance);
    c.childCoord("solder_mask_margin").ifPresent(fp::setSolderMaskMargin);
    c.childCoord("solder_paste_margin").ifPresent(fp::setSolderPasteMargin);
    c.childNumber("solder_paste_ratio").ifPresent(fp::setSolderPasteRatio);
    c.childInt("zone_connect").ifPresent(fp::setZoneConnectCode);
    TABLE.dispatch(c, fp);
    TABLE.finish(c, fp);
    return fp;
  }

  /** Reads {@code (model "path" (offset (xyz ...)) (scale (xyz ...)) (rotate (xyz ...)))}. */
  static Model3D model(Node node, ReadContext ctx) {
    NodeCursor c = NodeCursor.of(node, ctx);
    Model3D model = new Model3D(c.requireText(0, "model path"));
    model.setHide(c.flag("hide"));
    c.childNumber("opacity").ifPresent(model::setOpacity);
    c.childIf("offset", n -> Decoders.xyz(n).isPresent())
        .flatMap(Decoders::xyz)
        .ifPresent(model::setOffset);
    c.childIf("scale", n -> Decoders.xyz(n).isPresent())
        .flatMap(Decoders::xyz)
        .ifPresent(model::setScale);
    c.childIf("rotate", n -> Decoders.xyz(n).isPresent())
        .flatMap(Decoders::xyz)
        .ifPresent(model::setRotate);
    // legacy (at (xyz ...)) offsets are in inches
    c.finish(model, Set.of("at"));
    return model;
  }
}
