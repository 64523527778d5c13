package me.christianrobert.cnxpretext.transformer.builder;

/**
 * Target container for a CNXML {@code note}, chosen from its {@code class} attribute.
 */
public enum NoteKind {
  TRY("exercise", "Try It"),
  COLLABORATIVE("activity", "Collaborative Activity"),
  LAB("project", "Lab"),
  CALCULATOR("aside", "Calculator"),
  OBJECTIVES("objectives", null),
  PLAIN("note", null);

  private final String tag;
  private final String defaultTitle;

  NoteKind(String tag, String defaultTitle) {
    this.tag = tag;
    this.defaultTitle = defaultTitle;
  }

  public String getTag() {
    return tag;
  }

  /**
   * Title used when the note has none; null for kinds without one.
   */
  public String getDefaultTitle() {
    return defaultTitle;
  }

  /**
   * Matches on the class tokens; the first recognized token wins.
   */
  public static NoteKind of(String classAttribute) {
    if (classAttribute == null) {
      return PLAIN;
    }
    for (String token : classAttribute.trim().split("\\s+")) {
      switch (token) {
        case "try":
          return TRY;
        case "collab":
          return COLLABORATIVE;
        case "lab":
          return LAB;
        case "calculator":
          return CALCULATOR;
        case "chapter-objectives":
          return OBJECTIVES;
        default:
          break;
      }
    }
    return PLAIN;
  }
}
