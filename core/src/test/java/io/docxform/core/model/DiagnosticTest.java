package io.docxform.core.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.docxform.core.error.DiagnosticCode;
import org.junit.jupiter.api.Test;

class DiagnosticTest {

    @Test
    void spanDefaultsToNodeSpan() {
        Element a = new Element("a", SourceSpan.of(4, 9));

        Diagnostic diagnostic = Diagnostic.error(DiagnosticCode.MALFORMED_CONSTRUCT, "unterminated 'a'", a);

        assertThat(diagnostic.span()).isEqualTo(SourceSpan.of(4, 9));
        assertThat(diagnostic.node()).isSameAs(a);
        assertThat(diagnostic.isError()).isTrue();
    }

    @Test
    void formatSimpleRendersLineAndColumn() {
        String source = "<a>\n  <b>x";
        Element b = new Element("b", SourceSpan.of(6, 10));

        String rendered = Diagnostic.error(DiagnosticCode.MALFORMED_CONSTRUCT, "unterminated 'b'", b)
                .formatSimple(source);

        assertThat(rendered).isEqualTo("2:3: error[malformed-construct]: unterminated 'b'");
    }

    @Test
    void atReplacesSpan() {
        Diagnostic hint = Diagnostic.hint(DiagnosticCode.UNREGISTERED_NODE_TYPE, "no writer", null);

        assertThat(hint.span()).isEqualTo(SourceSpan.NONE);
        assertThat(hint.at(SourceSpan.at(3)).span()).isEqualTo(SourceSpan.of(3, 3));
        assertThat(hint.severity()).isEqualTo(Diagnostic.Severity.HINT);
    }

    @Test
    void invalidSpansAreRejected() {
        assertThatThrownBy(() -> SourceSpan.of(5, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> SourceSpan.of(-1, 4)).isInstanceOf(IllegalArgumentException.class);
        assertThat(SourceSpan.of(2, 5).extract("abcdefg")).isEqualTo("cde");
    }
}
