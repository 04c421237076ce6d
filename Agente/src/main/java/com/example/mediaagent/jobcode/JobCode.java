package com.example.mediaagent.jobcode;

import com.example.mediaagent.config.PreferencesStore;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coordena o código de trabalho usado nos templates de nome.
 *
 * Garante no máximo um pedido ao usuário em aberto. Dispositivos que precisam do código
 * enquanto o pedido está aberto ficam em espera e são devolvidos juntos quando o usuário confirma.
 */
public final class JobCode {

    private static final Logger log = LoggerFactory.getLogger(JobCode.class);

    private final PreferencesStore preferences;
    private final JobCodePrompt prompt;
    private final Set<Integer> waitingDevices = new LinkedHashSet<>();
    private boolean required;
    private String current = "";
    private boolean prompting;

    public JobCode(PreferencesStore preferences, JobCodePrompt prompt, boolean required) {
        this.preferences = Objects.requireNonNull(preferences, "preferences");
        this.prompt = Objects.requireNonNull(prompt, "prompt");
        this.required = required;
    }

    public String current() {
        return current;
    }

    public boolean hasCode() {
        return !current.isEmpty();
    }

    /** O esquema de nomes atual usa o código de trabalho? */
    public boolean requiredForNaming() {
        return required;
    }

    public void setRequiredForNaming(boolean required) {
        this.required = required;
    }

    public boolean promptOutstanding() {
        return prompting;
    }

    /** Precisa pedir o código (exigido e ainda não definido). */
    public boolean needToPrompt() {
        return required && !hasCode();
    }

    /**
     * Define um código sem perguntar (ex.: código configurado no ambiente).
     */
    public void set(String code, boolean remember) {
        Objects.requireNonNull(code, "code");
        current = code.trim();
        if (remember && hasCode()) {
            rememberCode(current);
        }
    }

    /**
     * Pede o código ao usuário para o dispositivo informado.
     * Se já há um pedido aberto, apenas registra o dispositivo na espera.
     *
     * @return true se um novo pedido foi exibido
     */
    public boolean request(int deviceId) {
        waitingDevices.add(deviceId);
        if (prompting) {
            log.debug("Pedido de codigo ja em aberto; dispositivo {} aguardando", deviceId);
            return false;
        }
        prompting = true;
        prompt.promptForJobCode(preferences.jobCodes(), preferences.rememberJobCode());
        return true;
    }

    public Set<Integer> waitingDevices() {
        return Collections.unmodifiableSet(waitingDevices);
    }

    /**
     * Confirmação do usuário. Atualiza a lista de códigos (mais recente primeiro, sem duplicatas)
     * quando {@code remember} e devolve os dispositivos que aguardavam.
     */
    public List<Integer> accept(String code, boolean remember) {
        prompting = false;
        preferences.setRememberJobCode(remember);
        set(code, remember);
        List<Integer> released = new ArrayList<>(waitingDevices);
        waitingDevices.clear();
        if (!hasCode()) {
            log.warn("Codigo de trabalho vazio; downloads aguardando foram cancelados");
            return List.of();
        }
        return released;
    }

    /**
     * Usuário cancelou: os dispositivos em espera continuam sem download.
     */
    public List<Integer> cancel() {
        prompting = false;
        List<Integer> dropped = new ArrayList<>(waitingDevices);
        waitingDevices.clear();
        return dropped;
    }

    /** Esquece um dispositivo em espera (ex.: foi removido). */
    public void forget(int deviceId) {
        waitingDevices.remove(deviceId);
    }

    /** Limpa o código atual ao fim de um ciclo de download. */
    public void reset() {
        current = "";
    }

    private void rememberCode(String code) {
        List<String> codes = new ArrayList<>(preferences.jobCodes());
        codes.remove(code);
        codes.add(0, code);
        preferences.setJobCodes(codes);
    }
}
