package cz.cas.jhinst.qsource3.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import cz.cas.jhinst.qsource3.api.SettingField;
import cz.cas.jhinst.qsource3.api.SettingsSnapshot;
import cz.cas.jhinst.qsource3.api.SnapshotLoadException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * SettingsSnapshotStore
 * -----------------------------------------------------------------------------
 * Reads and writes settings files: a JSON object with exactly the seven
 * settings keys ({@code mass_range}, {@code mz}, {@code dc_offset},
 * {@code dc_on}, {@code rod_polarity_positive}, {@code calib_points_mz},
 * {@code calib_points_resolution}).
 *
 * <p>The store performs no validation. {@link #read(Path)} returns the raw
 * candidate values for {@link SettingsMirror#replaceAll(Map,
 * cz.cas.jhinst.qsource3.api.UpdateOrigin)}, which decides whether the file is
 * acceptable as a whole.</p>
 *
 * <p>Files written by earlier tool versions used {@code dc_offst} for the DC
 * offset; that key is still accepted on read.</p>
 */
public final class SettingsSnapshotStore
{
    private static final String LEGACY_DC_OFFSET_KEY = "dc_offst";

    private final ObjectMapper mapper;

    public SettingsSnapshotStore(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public void write(Path file, SettingsSnapshot snapshot) throws IOException {
        Objects.requireNonNull(file, "file");
        Objects.requireNonNull(snapshot, "snapshot");

        ObjectNode root = mapper.createObjectNode();
        for (Map.Entry<SettingField, Object> e : snapshot.asMap().entrySet()) {
            root.set(e.getKey().snapshotKey(), mapper.valueToTree(e.getValue()));
        }
        mapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
    }

    /**
     * @return one raw candidate per field, not yet validated
     * @throws SnapshotLoadException if the file cannot be read, is not a JSON
     *                               object, or lacks a settings key
     */
    public Map<SettingField, Object> read(Path file) throws SnapshotLoadException {
        Objects.requireNonNull(file, "file");

        final JsonNode root;
        try {
            root = mapper.readTree(Files.readString(file));
        } catch (IOException e) {
            throw new SnapshotLoadException("Cannot read settings file " + file, e);
        }
        if (root == null || !root.isObject()) {
            throw new SnapshotLoadException("Settings file " + file + " does not contain a JSON object");
        }

        Map<SettingField, Object> candidate = new EnumMap<>(SettingField.class);
        for (SettingField field : SettingField.values()) {
            JsonNode node = root.get(field.snapshotKey());
            if (node == null && field == SettingField.DC_OFFSET) {
                node = root.get(LEGACY_DC_OFFSET_KEY);
            }
            if (node == null) {
                throw new SnapshotLoadException("Settings file " + file + " is missing key '" + field.snapshotKey() + "'");
            }
            try {
                candidate.put(field, mapper.treeToValue(node, Object.class));
            } catch (IOException e) {
                throw new SnapshotLoadException("Cannot decode '" + field.snapshotKey() + "' in " + file, e);
            }
        }
        return candidate;
    }
}
