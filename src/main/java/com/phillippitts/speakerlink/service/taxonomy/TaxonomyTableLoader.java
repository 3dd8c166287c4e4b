package com.phillippitts.speakerlink.service.taxonomy;

import com.phillippitts.speakerlink.domain.TaxonomyDomain;
import com.phillippitts.speakerlink.exception.TaxonomyLoadException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Loads taxonomy tables from JSON classpath resources.
 *
 * <p>Expected format of {@code <location>/<domain>.json}:
 * <pre>
 * {
 *   "domain": "expertise",
 *   "parents": [{"code": "technology", "display_name": "Technology &amp; Innovation"}],
 *   "categories": [
 *     {"code": "artificial_intelligence", "display_name": "...", "parent": "technology",
 *      "aliases": ["ai", "machine learning"]}
 *   ]
 * }
 * </pre>
 *
 * @since 1.0
 */
public final class TaxonomyTableLoader {

    private static final Logger LOG = LogManager.getLogger(TaxonomyTableLoader.class);

    private final String location;
    private final String version;
    private final ClassLoader classLoader;

    public TaxonomyTableLoader(String location, String version) {
        this(location, version, TaxonomyTableLoader.class.getClassLoader());
    }

    TaxonomyTableLoader(String location, String version, ClassLoader classLoader) {
        this.location = stripSlashes(Objects.requireNonNull(location, "location must not be null"));
        this.version = Objects.requireNonNull(version, "version must not be null");
        this.classLoader = Objects.requireNonNull(classLoader, "classLoader must not be null");
    }

    /**
     * Loads the table of one domain.
     *
     * @throws TaxonomyLoadException if the resource is missing, unreadable or malformed
     */
    public TaxonomyTable load(TaxonomyDomain domain) {
        String path = location.isEmpty() ? domain.resourceName() : location + "/" + domain.resourceName();
        String json = read(path);
        try {
            JSONObject root = new JSONObject(json);
            String declared = root.optString("domain", domain.id());
            if (!domain.id().equals(declared)) {
                throw new TaxonomyLoadException(path, "declares domain '" + declared + "', expected '"
                        + domain.id() + "'");
            }

            Map<String, String> parents = new LinkedHashMap<>();
            JSONArray parentArray = root.optJSONArray("parents");
            if (parentArray != null) {
                for (int i = 0; i < parentArray.length(); i++) {
                    JSONObject parent = parentArray.getJSONObject(i);
                    String code = parent.getString("code");
                    parents.put(code, parent.optString("display_name", code));
                }
            }

            List<TaxonomyCategory> categories = new ArrayList<>();
            JSONArray categoryArray = root.getJSONArray("categories");
            for (int i = 0; i < categoryArray.length(); i++) {
                categories.add(toCategory(categoryArray.getJSONObject(i)));
            }

            TaxonomyTable table = new TaxonomyTable(domain, version, categories, parents);
            LOG.info("Loaded {} taxonomy: {} categories, {} parents (version {})",
                    domain.id(), table.size(), parents.size(), version);
            return table;
        } catch (JSONException | IllegalArgumentException e) {
            throw new TaxonomyLoadException(path, e.getMessage(), e);
        }
    }

    private static TaxonomyCategory toCategory(JSONObject obj) {
        List<String> aliases = new ArrayList<>();
        JSONArray aliasArray = obj.optJSONArray("aliases");
        if (aliasArray != null) {
            for (int i = 0; i < aliasArray.length(); i++) {
                aliases.add(aliasArray.getString(i));
            }
        }
        String parent = obj.isNull("parent") ? null : obj.optString("parent", null);
        return new TaxonomyCategory(obj.getString("code"), obj.optString("display_name", null), parent, aliases);
    }

    private String read(String path) {
        try (InputStream in = classLoader.getResourceAsStream(path)) {
            if (in == null) {
                throw new TaxonomyLoadException(path, "resource not found on classpath");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new TaxonomyLoadException(path, "failed to read resource", e);
        }
    }

    private static String stripSlashes(String value) {
        String s = value.strip();
        while (s.startsWith("/")) {
            s = s.substring(1);
        }
        while (s.endsWith("/")) {
            s = s.substring(0, s.length() - 1);
        }
        return s;
    }
}
