package org.codex.compiler.backend.emit;

import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.codex.compiler.NotationCompiler;
import org.codex.runtime.model.Binding;
import org.codex.runtime.model.Module;
import org.codex.runtime.model.Symbol;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
class ModuleJsonCodecTest {

    private static final String SOURCE = """
            @deprecated: use `arrow.r`
            rarrow →
            arrow
              .r →
              @deprecated(r.old): gone
              .r.old →
              .l ←
            greek {
              alpha α
            }
            """;

    private final Module module = new NotationCompiler().compile(SOURCE, "test.txt");

    @Test
    void encodesBindingKinds() {
        JsonObject json = ModuleJsonCodec.encode(module);

        assertThat(json.keySet()).containsExactly("arrow", "greek", "rarrow");
        assertThat(json.getAsJsonObject("rarrow").get("symbol").getAsString()).isEqualTo("→");
        assertThat(json.getAsJsonObject("rarrow").get("deprecation").getAsString()).isEqualTo("use `arrow.r`");
        assertThat(json.getAsJsonObject("greek").getAsJsonObject("module").has("alpha")).isTrue();

        JsonObject old = json.getAsJsonObject("arrow").getAsJsonArray("variants").get(1).getAsJsonObject();
        assertThat(old.get("modifiers").getAsString()).isEqualTo("r.old");
        assertThat(old.get("deprecation").getAsString()).isEqualTo("gone");
    }

    @Test
    void decodesWhatItEncodes() {
        Module decoded = ModuleJsonCodec.fromJson(ModuleJsonCodec.toJson(module, true));

        assertThat(decoded).isEqualTo(module);
        assertThat(ModuleJsonCodec.fromJson(ModuleJsonCodec.toJson(module, false))).isEqualTo(module);
    }

    @Test
    void compactOutputIsOneLineAndUnescaped() {
        String json = ModuleJsonCodec.toJson(module, false);

        assertThat(json).doesNotContain("\n");
        assertThat(json).contains("\"symbol\":\"→\"");
        assertThat(json).contains("`arrow.r`");
    }

    @Test
    void decodesBundledCorpusLosslessly() throws IOException {
        Module sym = new NotationCompiler().compileResource("modules/sym.txt");

        assertThat(ModuleJsonCodec.fromJson(ModuleJsonCodec.toJson(sym, false))).isEqualTo(sym);
    }

    @Test
    void decodeSortsMembers() {
        Module decoded = ModuleJsonCodec.fromJson("{\"b\":{\"symbol\":\"β\"},\"a\":{\"symbol\":\"α\"}}");

        assertThat(decoded.entries()).extracting(Module.Entry::name).containsExactly("a", "b");
        assertThat(decoded.get("a")).map(Binding::def).contains(new Symbol.Single("α"));
    }

    @Test
    void rejectsMalformedInput() {
        assertThatThrownBy(() -> ModuleJsonCodec.fromJson("[]")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> ModuleJsonCodec.fromJson("{\"a\":1}")).isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> ModuleJsonCodec.fromJson("{\"a\":{}}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("'a'");
        assertThatThrownBy(() -> ModuleJsonCodec.fromJson("{\"a\":{\"variants\":[{\"modifiers\":\"r.r\",\"value\":\"x\"}]}}"))
                .isInstanceOf(JsonParseException.class);
        assertThatThrownBy(() -> ModuleJsonCodec.fromJson("{\"a\":{\"variants\":[]}}"))
                .isInstanceOf(JsonParseException.class)
                .hasMessageContaining("no variants");
        assertThatThrownBy(() -> ModuleJsonCodec.decode(JsonParser.parseString("{\"a\":{\"variants\":[{\"value\":\"x\"}]}}").getAsJsonObject()))
                .isInstanceOf(JsonParseException.class);
    }

    @Test
    void rejectsWronglyTypedMembers() {
        String[] shapes = {
                "{\"a\":{\"module\":\"x\"}}",
                "{\"a\":{\"symbol\":{}}}",
                "{\"a\":{\"symbol\":null}}",
                "{\"a\":{\"deprecation\":null,\"symbol\":\"x\"}}",
                "{\"a\":{\"variants\":[1]}}",
                "{\"a\":{\"variants\":\"x\"}}",
                "{\"a\":{\"variants\":[{\"modifiers\":[],\"value\":\"x\"}]}}",
                "{\"a\":{\"variants\":[{\"modifiers\":\"r\",\"value\":\"x\",\"deprecation\":1}]}}"
        };

        for (String shape : shapes) {
            assertThatThrownBy(() -> ModuleJsonCodec.fromJson(shape))
                    .describedAs(shape)
                    .isInstanceOf(JsonParseException.class)
                    .hasMessageContaining("'a'");
        }
    }
}
