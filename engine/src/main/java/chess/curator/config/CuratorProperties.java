package chess.curator.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the curator.
 * 
 * Defaults live in {@code application.properties} and can be overridden per run, e.g.
 * {@code java -jar pgn-curator.jar build repertoire.yml --curator.depth=12 --curator.strict-filters=true}
 */
@Component
@ConfigurationProperties(prefix = "curator")
public class CuratorProperties {
  private int depth = 10;
  private boolean strictFilters = false;
  private String curatorTag = "pgn-curator";

  /**
   * Move pairs kept per variation when a game does not set {@code max_depth}.
   * @return number of full moves
   */
  public int getDepth() {
    return depth;
  }

  public void setDepth(int depth) {
    this.depth = depth;
  }

  /**
   * When true, a remove or add entry that does not resolve fails its game instead of only
   * being reported. Unresolved plan comments are reported either way.
   * @return true if unresolved entries are fatal
   */
  public boolean isStrictFilters() {
    return strictFilters;
  }

  public void setStrictFilters(boolean strictFilters) {
    this.strictFilters = strictFilters;
  }

  /**
   * Value written to the {@code Curator} tag of the first game of each output file.
   * @return curator tag value
   */
  public String getCuratorTag() {
    return curatorTag;
  }

  public void setCuratorTag(String curatorTag) {
    this.curatorTag = curatorTag;
  }
}
