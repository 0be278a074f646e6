package ru.aritmos.clusterreceiver.event;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Журнал событий в памяти.
 */
public class RecordingEventJournal implements EventJournal {

    private final List<ReceiverEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void record(ReceiverEvent event) {
        events.add(event);
    }

    @Override
    public List<ReceiverEvent> list(String project, String objId, int limit) {
        List<ReceiverEvent> out = new ArrayList<>();
        for (int i = events.size() - 1; i >= 0 && out.size() < limit; i--) {
            ReceiverEvent e = events.get(i);
            if ((project == null || project.equals(e.project())) && (objId == null || objId.equals(e.objId()))) {
                out.add(e);
            }
        }
        return out;
    }

    public List<ReceiverEvent> events() {
        return List.copyOf(events);
    }

    public List<ReceiverEvent> byAction(String action) {
        List<ReceiverEvent> out = new ArrayList<>();
        for (ReceiverEvent e : events) {
            if (action.equals(e.action())) {
                out.add(e);
            }
        }
        return out;
    }
}
