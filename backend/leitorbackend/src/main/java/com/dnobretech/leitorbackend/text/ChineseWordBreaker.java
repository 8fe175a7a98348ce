package com.dnobretech.leitorbackend.text;

import com.dnobretech.leitorbackend.exception.SegmentationFailedException;
import lombok.extern.slf4j.Slf4j;
import org.apache.lucene.analysis.Tokenizer;
import org.apache.lucene.analysis.cn.smart.HMMChineseTokenizer;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringReader;
import java.util.function.Supplier;

/**
 * Quebra de palavras em chines com o modelo HMM + dicionario do smartcn.
 * <p>
 * Os dicionarios sao carregados uma vez por processo, no primeiro uso, e depois so
 * lidos. Cada chamada cria seu proprio tokenizer; o modelo e compartilhado.
 */
@Slf4j
@Component
public class ChineseWordBreaker extends LuceneWordBreaker {

    private static final String WARM_UP_TEXT = "中文分词模型预热。";

    @Override
    public Language language() {
        return Language.ZH;
    }

    @Override
    protected Tokenizer newTokenizer() {
        return withModel(() -> {
            ModelHolder.ensureLoaded();
            return new HMMChineseTokenizer();
        });
    }

    /**
     * Falha na carga do dicionario aparece como ExceptionInInitializerError na primeira
     * chamada e NoClassDefFoundError nas seguintes; as duas viram falha de segmentacao.
     */
    static Tokenizer withModel(Supplier<Tokenizer> factory) {
        try {
            return factory.get();
        } catch (LinkageError | IllegalStateException e) {
            log.error("[segmenter] modelo zh indisponivel", e);
            throw new SegmentationFailedException(Language.ZH.code(), e);
        }
    }

    static boolean modelLoaded() {
        return ModelHolder.LOADED;
    }

    // inicializacao sob demanda: a JVM garante uma unica carga, sem lock depois dela
    private static final class ModelHolder {
        static final boolean LOADED = load();

        static void ensureLoaded() {
            if (!LOADED) throw new IllegalStateException("modelo de segmentacao chines indisponivel");
        }

        private static boolean load() {
            long t0 = System.nanoTime();
            try (Tokenizer warm = new HMMChineseTokenizer()) {
                warm.setReader(new StringReader(WARM_UP_TEXT));
                warm.reset();
                while (warm.incrementToken()) {
                    // so forca a leitura dos dicionarios
                }
                warm.end();
            } catch (IOException e) {
                throw new IllegalStateException("falha ao carregar o modelo de segmentacao chines", e);
            }
            log.info("[segmenter] modelo zh carregado em {} ms", (System.nanoTime() - t0) / 1_000_000);
            return true;
        }
    }
}
