package thompson.parser;

import java.util.regex.PatternSyntaxException;

/**
 * Pattern syntax exceptions for constructs which are valid regular expressions
 * but cannot be compiled into a byte-level Thompson NFA.
 */
public class UnsupportedPatternSyntaxException extends PatternSyntaxException {

  @java.io.Serial
  private static final long serialVersionUID = 4917532061482730117L;

  private final String featureCategory;

  /**
   * @param featureCategory capitalized plural name of the rejected construct, eg. "Anchors"
   * @param regex pattern being parsed
   * @param index position of the construct in the pattern
   */
  public UnsupportedPatternSyntaxException(String featureCategory, String regex, int index) {
    super(featureCategory + " have no byte-level NFA encoding", regex, index);
    this.featureCategory = featureCategory;
  }

  /**
   * @return capitalized plural name of the rejected construct
   */
  public String featureCategory() {
    return featureCategory;
  }
}
