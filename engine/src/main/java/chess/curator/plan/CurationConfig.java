package chess.curator.plan;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Root of a curation config file.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"name", "version", "created", "description", "source", "output", "configs"})
public class CurationConfig {
    private String name;
    private String version;
    private String created;
    private String description;
    private String source;
    private String output;
    private List<ColorConfig> configs = new ArrayList<>();

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public String getCreated() {
        return created;
    }

    public void setCreated(String created) {
        this.created = created;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public String getSource() {
        return source;
    }

    public void setSource(String source) {
        this.source = source;
    }

    public String getOutput() {
        return output;
    }

    public void setOutput(String output) {
        this.output = output;
    }

    public List<ColorConfig> getConfigs() {
        return configs;
    }

    public void setConfigs(List<ColorConfig> configs) {
        this.configs = configs == null ? new ArrayList<>() : configs;
    }

    /**
     * Config for {@code color}, or null when the file has none.
     */
    public ColorConfig forColor(RepertoireColor color) {
        for (ColorConfig config : configs) {
            if (config.getColor() == color) {
                return config;
            }
        }
        return null;
    }
}
