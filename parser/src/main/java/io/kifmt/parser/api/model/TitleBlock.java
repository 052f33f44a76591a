package io.kifmt.parser.api.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** Drawing sheet title block. Comments keep their source order; numbers run from 1 to 9. */
public class TitleBlock extends Element {
  private String title;
  private String date;
  private String revision;
  private String company;
  private final List<Comment> comments = new ArrayList<>();

  public String getTitle() {
    return title;
  }

  public void setTitle(String title) {
    this.title = title;
  }

  public String getDate() {
    return date;
  }

  public void setDate(String date) {
    this.date = date;
  }

  public String getRevision() {
    return revision;
  }

  public void setRevision(String revision) {
    this.revision = revision;
  }

  public String getCompany() {
    return company;
  }

  public void setCompany(String company) {
    this.company = company;
  }

  public List<Comment> getComments() {
    return comments;
  }

  /** @return the text of the comment with the number, if present */
  public Optional<String> comment(int number) {
    return comments.stream().filter(c -> c.number() == number).map(Comment::text).findFirst();
  }

  /** A numbered {@code (comment N "text")} line. */
  public record Comment(int number, String text) {}
}
