package com.rusticlang.compiler.stdlib;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import com.rusticlang.compiler.analysis.types.RusticType;
import com.rusticlang.compiler.analysis.types.TypeVariable;
import com.rusticlang.compiler.analysis.types.Types;

import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * 映射表 JSON 解析
 *
 * <pre>
 * { "formatVersion": 1, "version": "...",
 *   "modules": { "math": [ { "name": "sqrt", "params": ["float"], "returns": "float",
 *                            "args": ["VALUE"], "target": "f64::sqrt",
 *                            "template": "f64::sqrt({0})" } ] } }
 * </pre>
 */
final class MappingTableLoader {
    private static final Logger LOG = Logger.getLogger(MappingTableLoader.class.getName());

    MappingTable load(Reader reader) {
        JsonObject root;
        try {
            JsonElement element = JsonParser.parseReader(reader);
            if (!element.isJsonObject()) {
                throw new MappingTableException("Mapping table must be a JSON object");
            }
            root = element.getAsJsonObject();
        } catch (JsonParseException e) {
            throw new MappingTableException("Malformed mapping table: " + e.getMessage(), e);
        }

        int format = requireInt(root, "formatVersion", "<root>");
        if (format != MappingTable.FORMAT_VERSION) {
            throw new MappingTableException("Unsupported mapping table format version " + format
                    + " (expected " + MappingTable.FORMAT_VERSION + ")");
        }
        String version = root.has("version") ? root.get("version").getAsString() : "unversioned";

        if (!root.has("modules") || !root.get("modules").isJsonObject()) {
            throw new MappingTableException("Mapping table has no 'modules' object");
        }
        List<MappingEntry> entries = new ArrayList<MappingEntry>();
        JsonObject modules = root.getAsJsonObject("modules");
        for (String module : modules.keySet()) {
            JsonElement list = modules.get(module);
            if (!list.isJsonArray()) {
                throw new MappingTableException("Module '" + module + "' must map to an array");
            }
            for (JsonElement item : list.getAsJsonArray()) {
                if (!item.isJsonObject()) {
                    throw new MappingTableException("Entry in module '" + module + "' must be an object");
                }
                entries.add(parseEntry(module, item.getAsJsonObject()));
            }
        }
        MappingTable table = new MappingTable(version, entries);
        LOG.fine("Loaded mapping table " + version + " with " + table.size() + " entries");
        return table;
    }

    private MappingEntry parseEntry(String module, JsonObject obj) {
        String name = requireString(obj, "name", module);
        String where = module + "." + name;

        List<RusticType> params = new ArrayList<RusticType>();
        for (JsonElement p : requireArray(obj, "params", where)) {
            params.add(parseType(p.getAsString(), where));
        }
        RusticType returns = obj.has("returns") ? parseType(requireString(obj, "returns", where), where) : Types.VOID;

        List<ArgMode> modes = new ArrayList<ArgMode>();
        if (obj.has("args")) {
            for (JsonElement m : requireArray(obj, "args", where)) {
                try {
                    modes.add(ArgMode.valueOf(m.getAsString()));
                } catch (IllegalArgumentException e) {
                    throw new MappingTableException("Unknown argument mode '" + m.getAsString() + "' in " + where, e);
                }
            }
        } else {
            for (int i = 0; i < params.size(); i++) modes.add(ArgMode.VALUE);
        }
        if (modes.size() != params.size()) {
            throw new MappingTableException("Argument modes and params differ in length in " + where);
        }

        String target = requireString(obj, "target", where);
        String template = obj.has("template") ? requireString(obj, "template", where) : defaultTemplate(target, params.size());
        MappingEntry entry = new MappingEntry(module, name, params, returns, modes, target, template);
        if (entry.maxPlaceholder() >= params.size()) {
            throw new MappingTableException("Template of " + where + " references a missing argument");
        }
        return entry;
    }

    /** 无模板时按普通函数调用展开：target({0}, {1}) */
    private static String defaultTemplate(String target, int arity) {
        StringBuilder sb = new StringBuilder(target).append('(');
        for (int i = 0; i < arity; i++) {
            if (i > 0) sb.append(", ");
            sb.append('{').append(i).append('}');
        }
        return sb.append(')').toString();
    }

    /** 解析签名类型：int / float / bool / string / void / T / list[...] */
    static RusticType parseType(String text, String where) {
        String s = text.trim();
        if (s.startsWith("list[") && s.endsWith("]")) {
            return Types.listOf(parseType(s.substring(5, s.length() - 1), where));
        }
        RusticType primitive = Types.fromName(s);
        if (primitive != null) return primitive;
        if (s.length() == 1 && Character.isUpperCase(s.charAt(0))) {
            return new TypeVariable(s);
        }
        throw new MappingTableException("Unknown type '" + text + "' in " + where);
    }

    private static String requireString(JsonObject obj, String key, String where) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonPrimitive()) {
            throw new MappingTableException("Missing string '" + key + "' in " + where);
        }
        return e.getAsString();
    }

    private static int requireInt(JsonObject obj, String key, String where) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonPrimitive() || !e.getAsJsonPrimitive().isNumber()) {
            throw new MappingTableException("Missing number '" + key + "' in " + where);
        }
        return e.getAsInt();
    }

    private static JsonArray requireArray(JsonObject obj, String key, String where) {
        JsonElement e = obj.get(key);
        if (e == null || !e.isJsonArray()) {
            throw new MappingTableException("Missing array '" + key + "' in " + where);
        }
        return e.getAsJsonArray();
    }
}
