package org.relua.resolver.module;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
public class ReferenceExtractorTest {

    private final ReferenceExtractor extractor = new ReferenceExtractor();

    @Test
    void recognizesAllStaticForms() {
        String source = """
            local a = require("pkg.a")
            local b = require('pkg.b')
            local c = require "pkg.c"
            local d = require 'pkg.d'
            local e = require [[pkg.e]]
            local f = require([[pkg.f]])
            local g = require ( "pkg.g" )
            """;

        ExtractionResult result = extractor.extract(source);

        assertThat(result.identifiers())
            .containsExactly("pkg.a", "pkg.b", "pkg.c", "pkg.d", "pkg.e", "pkg.f", "pkg.g");
        assertThat(result.dynamicCount()).isZero();
        assertThat(result.malformedCount()).isZero();
    }

    @Test
    void reportsLineNumbers() {
        String source = "-- header\n\nlocal x = require(\"x\")\n";

        ExtractionResult result = extractor.extract(source);

        assertThat(result.references()).hasSize(1);
        assertThat(result.references().get(0))
            .isEqualTo(new ModuleReference.Identifier("x", 3));
    }

    @Test
    void preservesDuplicatesInSourceOrder() {
        String source = "require('b')\nrequire('a')\nrequire('b')\n";

        assertThat(extractor.extract(source).identifiers()).containsExactly("b", "a", "b");
    }

    @Test
    void ignoresCommentsAndStrings() {
        String source = """
            -- require("in.line.comment")
            --[[ require("in.block.comment") ]]
            --[==[
              require("in.leveled.comment")
            ]==]
            local s = "require('in.string')"
            local t = [[require("in.long.string")]]
            local real = require("real")
            """;

        assertThat(extractor.extract(source).identifiers()).containsExactly("real");
    }

    @Test
    void ignoresMemberCallsAndLongerIdentifiers() {
        String source = """
            obj.require("not.one")
            obj:require("not.two")
            myrequire("not.three")
            require_all("not.four")
            local r = require
            local ok = ("x" .. require("yes"))
            """;

        assertThat(extractor.extract(source).identifiers()).containsExactly("yes");
    }

    @Test
    void classifiesComputedArgumentsAsDynamic() {
        String source = """
            local a = require(name)
            local b = require("prefix." .. name)
            local c = require(getName())
            local d = require { "table" }
            """;

        ExtractionResult result = extractor.extract(source);

        assertThat(result.identifiers()).isEmpty();
        assertThat(result.dynamicCount()).isEqualTo(4);
        assertThat(result.references().get(1)).isInstanceOfSatisfying(ModuleReference.Dynamic.class,
            dynamic -> assertThat(dynamic.expression()).startsWith("(\"prefix.\""));
    }

    @Test
    void classifiesBrokenCallsAsMalformed() {
        String source = """
            local a = require()
            local b = require("a/b")
            local c = require("a..b")
            local d = require("unterminated
            """;

        ExtractionResult result = extractor.extract(source);

        assertThat(result.identifiers()).isEmpty();
        assertThat(result.malformedCount()).isEqualTo(4);
        assertThat(result.references().get(0)).isInstanceOfSatisfying(ModuleReference.Malformed.class,
            malformed -> assertThat(malformed.reason()).isEqualTo("missing module name"));
    }

    @Test
    void unterminatedArgumentListAtEndOfFileIsMalformed() {
        ExtractionResult result = extractor.extract("local a = require(");

        assertThat(result.malformedCount()).isEqualTo(1);
    }

    @Test
    void emptyTextHasNoReferences() {
        assertThat(extractor.extract("").references()).isEmpty();
    }
}
