package com.example.mediaagent.stage;

import com.example.mediaagent.stage.OffloadMessages.AssignProximityGroups;
import com.example.mediaagent.stage.OffloadMessages.ProximityGroup;
import com.example.mediaagent.stage.OffloadMessages.ProximityGroups;
import com.example.mediaagent.stage.OffloadMessages.Request;
import com.example.mediaagent.stage.OffloadMessages.Result;
import com.example.mediaagent.stage.OffloadMessages.TimedFile;
import com.example.mediaagent.worker.StageWorker;
import com.example.mediaagent.worker.WorkerContext;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Agrupa arquivos por proximidade temporal: ordenados pelo horário, um novo grupo
 * começa sempre que o intervalo para o arquivo anterior passa do limite.
 */
public final class OffloadWorker implements StageWorker<Request, Result> {

    @Override
    public void handle(Integer deviceId, Request request, WorkerContext<Result> context) {
        if (!(request instanceof AssignProximityGroups)) {
            throw new IllegalArgumentException("Requisicao desconhecida: " + request.getClass().getName());
        }
        AssignProximityGroups assign = (AssignProximityGroups) request;
        context.emit(deviceId, new ProximityGroups(group(assign.files(), assign.gapSeconds() * 1000L)));
    }

    static List<ProximityGroup> group(List<TimedFile> files, long gapMillis) {
        List<TimedFile> sorted = new ArrayList<>(files);
        sorted.sort(Comparator.comparingLong(TimedFile::modificationTime));
        List<ProximityGroup> groups = new ArrayList<>();
        List<String> current = new ArrayList<>();
        long start = 0;
        long last = 0;
        for (TimedFile f : sorted) {
            if (!current.isEmpty() && f.modificationTime() - last > gapMillis) {
                groups.add(new ProximityGroup(start, last, current));
                current = new ArrayList<>();
            }
            if (current.isEmpty()) {
                start = f.modificationTime();
            }
            current.add(f.uniqueId());
            last = f.modificationTime();
        }
        if (!current.isEmpty()) {
            groups.add(new ProximityGroup(start, last, current));
        }
        return groups;
    }
}
