package com.example.mediaagent.config;

import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

/**
 * Estado persistido entre sessões: códigos de trabalho usados e contadores de sequência.
 *
 * Sequências só são gravadas ao fim de um ciclo de download completo
 * (ou no encerramento, se um download foi interrompido).
 */
public interface PreferencesStore {

    /** Códigos de trabalho, do mais recente para o mais antigo. */
    List<String> jobCodes();

    void setJobCodes(List<String> codes);

    boolean rememberJobCode();

    void setRememberJobCode(boolean remember);

    int storedSequenceNo();

    /** Contador de downloads do dia; zera quando a data muda. */
    int downloadsToday(LocalDate today);

    void updateSequences(int storedSequenceNo, LocalDate day, int downloadsToday);

    void save() throws IOException;
}
