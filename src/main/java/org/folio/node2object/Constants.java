package org.folio.node2object;

public final class Constants {

  private Constants() {
    throw new IllegalStateException("This class holds constants only");
  }

  /**
   * Prefix prepended to every attribute name when it becomes a JSON key.
   */
  public static final String ATTRIBUTE_PREFIX = "@";

  /**
   * Key holding the text content of an element that also carries attributes.
   */
  public static final String TEXT_KEY = "#text";

  public static final String JSON_FORMATTED_OUTPUT = "node2object.json.formattedOutput";
}
