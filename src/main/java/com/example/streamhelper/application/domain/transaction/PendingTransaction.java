package com.example.streamhelper.application.domain.transaction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.example.streamhelper.application.domain.event.EntityReference;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;

import lombok.Getter;

/**
 * 單一聚合根進行中的交易 (僅存在於記憶體)
 *
 * <p>
 * 保存待提交事件與各實體 Stream 的聲稱版本；同一實體重複出現時以最後一次為準。
 * </p>
 */
public class PendingTransaction {

	@Getter
	private final String aggregateId;

	@Getter
	private final ExpectedStreamRevision expectedRevision;

	private final List<PendingEvent> events = new ArrayList<>();

	private final Map<String, Long> entityVersions = new LinkedHashMap<>();

	public PendingTransaction(String aggregateId, ExpectedStreamRevision expectedRevision) {
		this.aggregateId = aggregateId;
		this.expectedRevision = expectedRevision;
	}

	public void add(VersionedEvent event, List<EntityReference> affectedEntities, Map<String, Long> claimedVersions) {
		events.add(new PendingEvent(event, List.copyOf(affectedEntities)));
		entityVersions.putAll(claimedVersions);
	}

	public List<PendingEvent> getEvents() {
		return Collections.unmodifiableList(events);
	}

	public Map<String, Long> getEntityVersions() {
		return Collections.unmodifiableMap(entityVersions);
	}

	public boolean isEmpty() {
		return events.isEmpty();
	}
}
