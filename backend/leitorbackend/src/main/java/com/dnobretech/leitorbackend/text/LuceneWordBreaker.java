// src/main/java/com/dnobretech/leitorbackend/text/LuceneWordBreaker.java
package com.dnobretech.leitorbackend.text;

import com.dnobretech.leitorbackend.exception.SegmentationFailedException;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.tokenattributes.OffsetAttribute;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * Base para quebras feitas com um {@link Tokenizer} do Lucene.
 * <p>
 * Os tokenizers do Lucene descartam pontuacao e espacos. Aqui cada token e recortado
 * do texto original pelos offsets e os intervalos entre tokens viram separadores:
 * uma sequencia de espacos vira um token, qualquer outro code point vira um token sozinho.
 */
abstract class LuceneWordBreaker implements WordBreaker {

    protected abstract Tokenizer newTokenizer();

    @Override
    public List<String> split(String text) {
        List<String> out = new ArrayList<>();
        int cursor = 0;
        try (Tokenizer tokenizer = newTokenizer()) {
            OffsetAttribute offset = tokenizer.addAttribute(OffsetAttribute.class);
            tokenizer.setReader(new StringReader(text));
            tokenizer.reset();
            while (tokenizer.incrementToken()) {
                int start = offset.startOffset();
                int end = Math.min(offset.endOffset(), text.length());
                if (start < cursor || end <= start) continue;   // sobreposto ou vazio
                emitSeparators(text, cursor, start, out);
                out.add(text.substring(start, end));
                cursor = end;
            }
            tokenizer.end();
        } catch (IOException e) {
            throw new SegmentationFailedException(language().code(), e);
        }
        emitSeparators(text, cursor, text.length(), out);
        return out;
    }

    static void emitSeparators(String text, int from, int to, List<String> out) {
        int i = from;
        while (i < to) {
            int cp = text.codePointAt(i);
            int next = i + Character.charCount(cp);
            if (Character.isWhitespace(cp) || Character.isSpaceChar(cp)) {
                while (next < to) {
                    int c = text.codePointAt(next);
                    if (!Character.isWhitespace(c) && !Character.isSpaceChar(c)) break;
                    next += Character.charCount(c);
                }
            }
            out.add(text.substring(i, next));
            i = next;
        }
    }
}
