package com.example.mediaagent.device;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Registro de dispositivos: identificador opaco -> dispositivo e estado no pipeline.
 *
 * É a única fonte de verdade sobre o estado dos dispositivos. Toda transição passa
 * por {@link #transition(int, DeviceState)}, que valida a tabela de {@link DeviceState}.
 * Não é thread-safe: só a thread do orquestrador a utiliza.
 */
public final class DeviceCollection {

    private static final Logger log = LoggerFactory.getLogger(DeviceCollection.class);

    private final Map<Integer, Device> devices = new LinkedHashMap<>();
    private int nextId = 1;

    /**
     * Registra um dispositivo e devolve seu identificador, estável durante a sessão.
     */
    public int add(DeviceDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        int id = nextId++;
        devices.put(id, new Device(id, descriptor));
        log.info("Dispositivo registrado: id={} {}", id, descriptor);
        return id;
    }

    public Optional<Device> find(int id) {
        return Optional.ofNullable(devices.get(id));
    }

    public Device get(int id) {
        Device d = devices.get(id);
        if (d == null) {
            throw new IllegalStateException("Dispositivo desconhecido: " + id);
        }
        return d;
    }

    public boolean contains(int id) {
        return devices.containsKey(id);
    }

    public int size() {
        return devices.size();
    }

    public boolean isEmpty() {
        return devices.isEmpty();
    }

    public Collection<Device> devices() {
        return List.copyOf(devices.values());
    }

    public List<Integer> idsInState(DeviceState state) {
        List<Integer> ids = new ArrayList<>();
        for (Device d : devices.values()) {
            if (d.state() == state) {
                ids.add(d.id());
            }
        }
        return ids;
    }

    public Optional<Integer> idForCamera(CameraKey key) {
        for (Device d : devices.values()) {
            if (d.descriptor().cameraKey().map(key::equals).orElse(false)) {
                return Optional.of(d.id());
            }
        }
        return Optional.empty();
    }

    public Optional<Integer> idForPath(String path) {
        for (Device d : devices.values()) {
            if (d.kind() != DeviceKind.CAMERA && d.descriptor().path().equals(path)) {
                return Optional.of(d.id());
            }
        }
        return Optional.empty();
    }

    /**
     * Aplica uma transição de estado validada.
     *
     * @throws IllegalStateException se o dispositivo não existe ou a transição é ilegal
     */
    public void transition(int id, DeviceState next) {
        Device d = get(id);
        DeviceState current = d.state();
        if (current == next) {
            return;
        }
        if (!current.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Transição ilegal para dispositivo " + id + ": " + current + " -> " + next);
        }
        d.setState(next);
        log.debug("Dispositivo {}: {} -> {}", id, current, next);
    }

    /**
     * Remove o dispositivo (estado REMOVED) e libera o identificador.
     * Remover um dispositivo já removido não tem efeito.
     *
     * @return o dispositivo removido, ou vazio se já havia sido removido ou é desconhecido
     */
    public Optional<Device> remove(int id) {
        Device d = devices.remove(id);
        if (d == null) {
            return Optional.empty();
        }
        d.setState(DeviceState.REMOVED);
        log.info("Dispositivo removido: id={} {}", id, d.descriptor());
        return Optional.of(d);
    }
}
