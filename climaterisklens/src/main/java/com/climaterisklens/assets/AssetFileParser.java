package com.climaterisklens.assets;

import com.climaterisklens.util.AsciiSanitizer;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.opencsv.CSVReaderHeaderAware;
import com.opencsv.exceptions.CsvException;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses uploaded site files. CSV needs a header with name, lat and lon; GeoJSON
 * must be a FeatureCollection of Point features. The whole file is rejected on
 * the first bad row.
 */
public final class AssetFileParser {
    private final ObjectMapper om;

    public AssetFileParser(ObjectMapper om) {
        this.om = om;
    }

    public ParsedUpload parse(String filename, byte[] content) throws InvalidUploadException {
        String lower = filename == null ? "" : filename.toLowerCase(Locale.ROOT).trim();
        String text = new String(content, StandardCharsets.UTF_8);
        if (text.startsWith("\uFEFF"))
            text = text.substring(1);
        List<ParsedSite> sites;
        String fileType;
        if (lower.endsWith(".csv")) {
            sites = parseCsv(text);
            fileType = "csv";
        } else if (lower.endsWith(".geojson")) {
            sites = parseGeoJson(text);
            fileType = "geojson";
        } else {
            throw new InvalidUploadException("unsupported_format",
                    "Unsupported file format; upload a .csv or .geojson file");
        }
        if (sites.isEmpty())
            throw new InvalidUploadException("invalid_file", "File contains no sites");
        return new ParsedUpload(fileType, fileType + "_upload", sites);
    }

    List<ParsedSite> parseCsv(String text) throws InvalidUploadException {
        List<ParsedSite> out = new ArrayList<>();
        try (CSVReaderHeaderAware reader = new CSVReaderHeaderAware(new StringReader(text))) {
            Map<String, String> raw;
            while ((raw = reader.readMap()) != null) {
                Map<String, String> row = normalizeKeys(raw);
                int n = out.size() + 1;
                double lat = number(row.get("lat"), "lat", n);
                double lon = number(row.get("lon"), "lon", n);
                out.add(site(row.get("name"), lat, lon, n));
            }
        } catch (IOException | CsvException e) {
            throw new InvalidUploadException("invalid_file", "Failed to process file: " + e.getMessage());
        }
        return out;
    }

    List<ParsedSite> parseGeoJson(String text) throws InvalidUploadException {
        JsonNode root;
        try {
            root = om.readTree(text);
        } catch (IOException e) {
            throw new InvalidUploadException("invalid_file", "Failed to process file: invalid JSON");
        }
        if (root == null || !"FeatureCollection".equals(root.path("type").asText())
                || !root.path("features").isArray()) {
            throw new InvalidUploadException("invalid_file", "Failed to process file: expected a FeatureCollection");
        }
        List<ParsedSite> out = new ArrayList<>();
        for (JsonNode f : root.path("features")) {
            int n = out.size() + 1;
            JsonNode geom = f.path("geometry");
            JsonNode coords = geom.path("coordinates");
            if (!"Point".equals(geom.path("type").asText()) || !coords.isArray() || coords.size() < 2
                    || !coords.get(0).isNumber() || !coords.get(1).isNumber()) {
                throw new InvalidUploadException("invalid_file",
                        "Failed to process file: feature " + n + " is not a Point");
            }
            JsonNode name = f.path("properties").path("name");
            out.add(site(name.isTextual() ? name.asText() : null, coords.get(1).asDouble(),
                    coords.get(0).asDouble(), n));
        }
        return out;
    }

    private static ParsedSite site(String rawName, double lat, double lon, int n) throws InvalidUploadException {
        if (lat < -90.0 || lat > 90.0 || lon < -180.0 || lon > 180.0) {
            throw new InvalidUploadException("invalid_file",
                    "Failed to process file: coordinates out of range in row " + n);
        }
        String name = AsciiSanitizer.sanitizeText(rawName);
        if (name == null || name.isBlank())
            name = "Site " + n;
        return new ParsedSite(name, lat, lon);
    }

    private static double number(String v, String field, int n) throws InvalidUploadException {
        if (v == null || v.isBlank())
            throw new InvalidUploadException("invalid_file", "Failed to process file: missing " + field + " in row " + n);
        try {
            double d = Double.parseDouble(v.trim());
            if (Double.isNaN(d) || Double.isInfinite(d))
                throw new NumberFormatException(v);
            return d;
        } catch (NumberFormatException e) {
            throw new InvalidUploadException("invalid_file",
                    "Failed to process file: bad " + field + " '" + v + "' in row " + n);
        }
    }

    private static Map<String, String> normalizeKeys(Map<String, String> raw) {
        Map<String, String> out = new HashMap<>();
        for (Map.Entry<String, String> e : raw.entrySet()) {
            if (e.getKey() != null)
                out.put(e.getKey().trim().toLowerCase(Locale.ROOT), e.getValue());
        }
        return out;
    }

    public record ParsedSite(String name, double lat, double lon) {
    }

    /**
     * Sites of one file plus its type ("csv" or "geojson") and metadata source
     * tag.
     */
    public record ParsedUpload(String fileType, String source, List<ParsedSite> sites) {
    }
}
