package com.dnobretech.leitorbackend.text;

import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.standard.StandardTokenizer;
import org.springframework.stereotype.Component;

/** Fronteiras de palavra do Unicode (UAX#29) para idiomas separados por espacos. */
@Component
public class UnicodeWordBreaker extends LuceneWordBreaker {

    @Override
    public Language language() {
        return Language.EN;
    }

    @Override
    protected Tokenizer newTokenizer() {
        return new StandardTokenizer();
    }
}
