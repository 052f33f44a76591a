package io.kifmt.parser.impl.pcb;

import io.kifmt.parser.api.DocumentKind;
import io.kifmt.parser.api.model.Graphic;
import io.kifmt.parser.api.pcb.Board;
import io.kifmt.parser.api.pcb.Footprint;
import io.kifmt.parser.api.pcb.LayerDefinition;
import io.kifmt.parser.api.pcb.Net;
import io.kifmt.parser.api.pcb.NetClass;
import io.kifmt.parser.api.pcb.PcbText;
import io.kifmt.parser.api.pcb.Track;
import io.kifmt.parser.api.pcb.TrackArc;
import io.kifmt.parser.api.pcb.Via;
import io.kifmt.parser.api.pcb.Zone;
import io.kifmt.parser.impl.DocumentWriter;
import io.kifmt.parser.impl.GraphicWriter;
import io.kifmt.parser.impl.Headers;
import io.kifmt.parser.internal_api.Encoders;
import io.kifmt.sexpr.Node;

public final class BoardWriter implements DocumentWriter<Board> {
  @Override
  public Node write(Board board) {
    Node.Builder b = Node.builder(DocumentKind.BOARD.rootToken());
    Headers.write(b, board);
    if (board.getPaper() != null) {
      b.child(Headers.paper(board.getPaper()));
    }
    if (board.getTitleBlock() != null) {
      b.child(Headers.titleBlock(board.getTitleBlock()));
    }
    if (!board.getLayers().isEmpty() || board.hadTypedChild("layers")) {
      Node.Builder layers = Node.builder("layers");
      for (LayerDefinition layer : board.getLayers()) {
        layers.child(layer(layer));
      }
      b.child(layers.build());
    }
    for (Net net : board.getNets()) {
      b.child(
          Encoders.finish(
              Node.builder("net")
                  .integer(net.getNumber())
                  .value(Encoders.text(net, "@1", net.getName())),
              net));
    }
    for (NetClass netClass : board.getNetClasses()) {
      b.child(netClass(netClass));
    }
    for (Footprint fp : board.getFootprints()) {
      b.child(FootprintWriter.writeFootprint(fp));
    }
    for (Graphic g : board.getGraphics()) {
      b.child(GraphicWriter.write(g));
    }
    for (PcbText text : board.getTexts()) {
      b.child(PcbTextWriter.write(text));
    }
    for (Track track : board.getTracks()) {
      b.child(track(track));
    }
    for (TrackArc arc : board.getArcs()) {
      b.child(arc(arc));
    }
    for (Via via : board.getVias()) {
      b.child(via(via));
    }
    for (Zone zone : board.getZones()) {
      b.child(ZoneWriter.write(zone));
    }
    return Encoders.finish(b, board);
  }

  private static Node layer(LayerDefinition layer) {
    Node.Builder b =
        Node.builder(Integer.toString(layer.getOrdinal()))
            .value(Encoders.text(layer, "@0", layer.getName()))
            .value(Encoders.word(layer.getType()));
    if (layer.getUserName() != null) {
      b.value(Encoders.text(layer, "@2", layer.getUserName()));
    }
    return Encoders.finish(b, layer);
  }

  private static Node netClass(NetClass netClass) {
    Node.Builder b =
        Node.builder("net_class").value(Encoders.text(netClass, "@0", netClass.getName()));
    if (netClass.getDescription() != null) {
      b.value(Encoders.text(netClass, "@1", netClass.getDescription()));
    }
    for (String net : netClass.getNets()) {
      Encoders.putText(b, netClass, "add_net", net);
    }
    return Encoders.finish(b, netClass);
  }

  private static Node track(Track track) {
    Node.Builder b = Node.builder("segment");
    Encoders.putFlag(b, "locked", track.getLocked());
    Encoders.putPoint(b, "start", track.getStart());
    Encoders.putPoint(b, "end", track.getEnd());
    Encoders.putCoord(b, "width", track.getWidth());
    Encoders.putText(b, track, "layer", track.getLayer());
    Encoders.putInt(b, "net", track.getNet());
    Encoders.putUuid(b, track.getUuid());
    return Encoders.finish(b, track);
  }

  private static Node arc(TrackArc arc) {
    Node.Builder b = Node.builder("arc");
    Encoders.putFlag(b, "locked", arc.getLocked());
    Encoders.putPoint(b, "start", arc.getStart());
    Encoders.putPoint(b, "mid", arc.getMid());
    Encoders.putPoint(b, "end", arc.getEnd());
    Encoders.putCoord(b, "width", arc.getWidth());
    Encoders.putText(b, arc, "layer", arc.getLayer());
    Encoders.putInt(b, "net", arc.getNet());
    Encoders.putUuid(b, arc.getUuid());
    return Encoders.finish(b, arc);
  }

  private static Node via(Via via) {
    Node.Builder b = Node.builder("via");
    if (via.getTypeToken() != null) {
      b.symbol(via.getTypeToken());
    }
    Encoders.putFlag(b, "locked", via.getLocked());
    Encoders.putPoint(b, "at", via.getPosition());
    Encoders.putCoord(b, "size", via.getSize());
    Encoders.putCoord(b, "drill", via.getDrill());
    if (!via.getLayers().isEmpty() || via.hadTypedChild("layers")) {
      Encoders.putTexts(b, via, "layers", via.getLayers());
    }
    Encoders.putFlag(b, "free", via.getFree());
    Encoders.putInt(b, "net", via.getNet());
    Encoders.putUuid(b, via.getUuid());
    return Encoders.finish(b, via);
  }
}
