package org.tabelle.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TokenSequenceTest {

    @Test
    void consumesFrontToBackAndKeepsEnd() {
        TokenSequence tokens = new TokenSequence(List.of(
                new Token(TokenKind.SYMBOL, "p", 0),
                Token.end(1)));

        assertThat(tokens.next().getText()).isEqualTo("p");
        assertThat(tokens.isAtEnd()).isTrue();
        assertThat(tokens.next().getKind()).isEqualTo(TokenKind.END);
        assertThat(tokens.next().getKind()).isEqualTo(TokenKind.END);
        assertThat(tokens.remaining()).containsExactly(Token.end(1));
    }

    @Test
    void acceptConsumesOnlyMatchingKind() {
        TokenSequence tokens = new TokenSequence(List.of(
                new Token(TokenKind.NOT, "~", 0),
                new Token(TokenKind.SYMBOL, "p", 1),
                Token.end(2)));

        assertThat(tokens.accept(TokenKind.SYMBOL)).isFalse();
        assertThat(tokens.accept(TokenKind.NOT)).isTrue();
        assertThat(tokens.peek().getText()).isEqualTo("p");
        assertThat(tokens).hasToString("[p, END]");
    }

    @Test
    void rejectsSequencesWithoutTrailingEnd() {
        assertThatThrownBy(() -> new TokenSequence(List.of(new Token(TokenKind.SYMBOL, "p", 0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenSequence(List.of(Token.end(0), Token.end(0))))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new TokenSequence(List.of()))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
