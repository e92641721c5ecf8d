package org.codex.compiler.backend.emit;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Def;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.ModifierSet;
import org.codex.runtime.model.Symbol;
import org.codex.runtime.model.Variant;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Serializes a frozen {@link Module} tree to JSON and back.
 * <p>
 * Layout: a module is an object with one member per binding, in name order. A binding holds an
 * optional {@code deprecation} and exactly one of {@code module} (nested object), {@code symbol}
 * (the value of a single symbol) or {@code variants} (an array of
 * {@code {modifiers, value, deprecation?}} objects).
 */
public final class ModuleJsonCodec {

    private static final String DEPRECATION = "deprecation";
    private static final String MODULE = "module";
    private static final String SYMBOL = "symbol";
    private static final String VARIANTS = "variants";
    private static final String MODIFIERS = "modifiers";
    private static final String VALUE = "value";

    private ModuleJsonCodec() {}

    /**
     * Encodes a module as a JSON string.
     * @param module The module to encode.
     * @param pretty Whether to pretty-print the output.
     */
    public static String toJson(Module module, boolean pretty) {
        GsonBuilder builder = new GsonBuilder().disableHtmlEscaping();
        if (pretty) {
            builder.setPrettyPrinting();
        }
        Gson gson = builder.create();
        return gson.toJson(encode(module));
    }

    /**
     * Decodes a module from a JSON string.
     * @throws JsonParseException if the text is not a valid encoded module.
     */
    public static Module fromJson(String json) {
        JsonElement root = JsonParser.parseString(json);
        if (!root.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object at the top level");
        }
        return decode(root.getAsJsonObject());
    }

    public static JsonObject encode(Module module) {
        JsonObject json = new JsonObject();
        for (Module.Entry entry : module) {
            json.add(entry.name(), encodeBinding(entry.binding()));
        }
        return json;
    }

    private static JsonObject encodeBinding(Binding binding) {
        JsonObject json = new JsonObject();
        if (binding.deprecation() != null) {
            json.addProperty(DEPRECATION, binding.deprecation());
        }
        Def def = binding.def();
        if (def instanceof Module module) {
            json.add(MODULE, encode(module));
        } else if (def instanceof Symbol.Single single) {
            json.addProperty(SYMBOL, single.value());
        } else if (def instanceof Symbol.Multi multi) {
            JsonArray variants = new JsonArray();
            for (Variant variant : multi.variants()) {
                JsonObject v = new JsonObject();
                v.addProperty(MODIFIERS, variant.modifiers().toString());
                v.addProperty(VALUE, variant.value());
                if (variant.deprecation() != null) {
                    v.addProperty(DEPRECATION, variant.deprecation());
                }
                variants.add(v);
            }
            json.add(VARIANTS, variants);
        }
        return json;
    }

    public static Module decode(JsonObject json) {
        List<Module.Entry> entries = new ArrayList<>();
        for (Map.Entry<String, JsonElement> member : json.entrySet()) {
            if (!member.getValue().isJsonObject()) {
                throw new JsonParseException("Binding '" + member.getKey() + "' is not an object");
            }
            entries.add(new Module.Entry(member.getKey(), decodeBinding(member.getKey(), member.getValue().getAsJsonObject())));
        }
        try {
            return Module.of(entries);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException(e.getMessage(), e);
        }
    }

    private static Binding decodeBinding(String name, JsonObject json) {
        String deprecation = optionalString(json, DEPRECATION, name);
        if (json.has(MODULE)) {
            JsonElement module = json.get(MODULE);
            if (!module.isJsonObject()) {
                throw new JsonParseException("Module '" + name + "' is not an object");
            }
            return new Binding(decode(module.getAsJsonObject()), deprecation);
        }
        if (json.has(SYMBOL)) {
            return new Binding(new Symbol.Single(requiredString(json, SYMBOL, name)), deprecation);
        }
        if (json.has(VARIANTS)) {
            JsonElement array = json.get(VARIANTS);
            if (!array.isJsonArray()) {
                throw new JsonParseException("Variants of '" + name + "' are not an array");
            }
            List<Variant> variants = new ArrayList<>();
            for (JsonElement element : array.getAsJsonArray()) {
                variants.add(decodeVariant(name, element));
            }
            if (variants.isEmpty()) {
                throw new JsonParseException("Binding '" + name + "' has no variants");
            }
            return new Binding(new Symbol.Multi(variants), deprecation);
        }
        throw new JsonParseException("Binding '" + name + "' has neither module, symbol nor variants");
    }

    private static Variant decodeVariant(String name, JsonElement element) {
        if (!element.isJsonObject()) {
            throw new JsonParseException("Malformed variant of '" + name + "': " + element);
        }
        JsonObject v = element.getAsJsonObject();
        String modifiers = requiredString(v, MODIFIERS, name);
        String value = requiredString(v, VALUE, name);
        String deprecation = optionalString(v, DEPRECATION, name);
        try {
            return new Variant(ModifierSet.fromRawDotted(modifiers), value, deprecation);
        } catch (IllegalArgumentException e) {
            throw new JsonParseException("Malformed variant of '" + name + "': " + v, e);
        }
    }

    private static String requiredString(JsonObject json, String member, String name) {
        String value = optionalString(json, member, name);
        if (value == null) {
            throw new JsonParseException("Missing '" + member + "' in '" + name + "'");
        }
        return value;
    }

    private static String optionalString(JsonObject json, String member, String name) {
        if (!json.has(member)) {
            return null;
        }
        JsonElement element = json.get(member);
        if (!element.isJsonPrimitive() || !element.getAsJsonPrimitive().isString()) {
            throw new JsonParseException("Member '" + member + "' of '" + name + "' is not a string: " + element);
        }
        return element.getAsString();
    }
}
