package com.example.mediaagent.jobcode;

import java.util.List;

/**
 * Exibe o pedido de código de trabalho ao usuário. A resposta volta de forma assíncrona
 * por {@code DownloadOrchestrator#jobCodeEntered} ou {@code #jobCodeCancelled}.
 */
@FunctionalInterface
public interface JobCodePrompt {

    void promptForJobCode(List<String> previousCodes, boolean rememberDefault);
}
