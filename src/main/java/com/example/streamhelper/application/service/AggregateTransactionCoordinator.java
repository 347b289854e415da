package com.example.streamhelper.application.service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import com.example.streamhelper.application.domain.event.EntityReference;
import com.example.streamhelper.application.domain.event.VersionedEvent;
import com.example.streamhelper.application.domain.stream.EventReducer;
import com.example.streamhelper.application.domain.stream.ExpectedStreamRevision;
import com.example.streamhelper.application.domain.stream.StreamNaming;
import com.example.streamhelper.application.domain.stream.StreamState;
import com.example.streamhelper.application.domain.transaction.PendingEvent;
import com.example.streamhelper.application.domain.transaction.PendingTransaction;
import com.example.streamhelper.application.domain.transaction.TransactionState;
import com.example.streamhelper.application.port.EventLogPort;
import com.example.streamhelper.application.shared.exception.NoActiveTransactionException;

import lombok.extern.slf4j.Slf4j;
import tools.jackson.databind.node.ArrayNode;
import tools.jackson.databind.node.JsonNodeFactory;
import tools.jackson.databind.node.ObjectNode;

/**
 * 聚合根交易協調器
 *
 * <p>
 * 將要寫入聚合根 Stream 與其從屬實體 Stream 的事件先暫存於記憶體，提交時再依序寫入 Event Log。
 * </p>
 *
 * <h2>一致性等級：</h2>
 * <ul>
 * <li><b>循序、盡力而為</b>：先寫各實體 Stream 的副本，最後一次寫入聚合根 Stream 的整批事件。</li>
 * <li><b>不做補償</b>：中途失敗時只清除記憶體中的交易，已完成的寫入不會撤回。呼叫端重試時，實體 Stream
 * 必須能容忍重複事件。</li>
 * <li><b>單一寫入者</b>：同一個 aggregateId 的操作須由呼叫端自行序列化；真正的並行保護是 Event Log
 * 的 expected revision 檢查。</li>
 * </ul>
 */
@Slf4j
public class AggregateTransactionCoordinator {

	/**
	 * 寫入事件 metadata 時，記錄受影響實體的欄位名稱
	 */
	public static final String AFFECTED_ENTITIES_KEY = "affectedEntities";

	private final StreamReconstructor reconstructor;

	private final EventLogPort eventLog;

	private final StreamNaming naming;

	private final ConcurrentMap<String, PendingTransaction> transactions = new ConcurrentHashMap<>();

	public AggregateTransactionCoordinator(StreamReconstructor reconstructor, EventLogPort eventLog,
			StreamNaming naming) {
		this.reconstructor = reconstructor;
		this.eventLog = eventLog;
		this.naming = naming;
	}

	/**
	 * 重建聚合根目前的狀態
	 */
	public <S> StreamState<S> getAggregateState(String aggregateId, Class<S> stateType, EventReducer<S> applyEvent) {
		return reconstructor.getCurrentState(naming.aggregateStream(aggregateId), stateType, applyEvent);
	}

	/**
	 * 開始交易，聚合根 Stream 提交時不檢查版本
	 * <p>
	 * 若已有進行中的交易，待提交事件會被清空 (以最後一次呼叫為準)。
	 * </p>
	 */
	public void beginTransaction(String aggregateId) {
		open(aggregateId, ExpectedStreamRevision.any());
	}

	/**
	 * 開始交易，並要求提交時聚合根仍停留在 {@code expectedVersion} (已套用的事件數)
	 */
	public void beginTransaction(String aggregateId, long expectedVersion) {
		open(aggregateId, ExpectedStreamRevision.afterVersion(expectedVersion));
	}

	/**
	 * 將事件加入進行中的交易
	 *
	 * @param aggregateId      聚合根 ID
	 * @param event            事件
	 * @param affectedEntities 需要一併收到此事件的從屬實體
	 * @throws NoActiveTransactionException 尚未呼叫 beginTransaction
	 */
	public void addEvent(String aggregateId, VersionedEvent event, List<EntityReference> affectedEntities) {
		List<EntityReference> refs = affectedEntities != null ? affectedEntities : List.of();
		VersionedEvent prepared = withAffectedEntities(reconstructor.withCurrentVersion(event), refs);

		Map<String, Long> claimedVersions = new LinkedHashMap<>();
		for (EntityReference ref : refs) {
			claimedVersions.put(naming.entityStream(ref.getType(), ref.getId()), ref.getVersion());
		}

		transactions.compute(aggregateId, (id, tx) -> {
			if (tx == null) {
				throw new NoActiveTransactionException(id);
			}
			tx.add(prepared, refs, claimedVersions);
			return tx;
		});
		log.debug("[Tx] 事件 {} 已加入聚合根 {} 的交易，影響實體 {} 個", prepared.getType(), aggregateId, refs.size());
	}

	/**
	 * 提交交易
	 *
	 * <pre>
	 * 1. 取出並移除交易 (不論成功與否，之後都回到 NO_TRANSACTION)
	 * 2. 逐筆事件寫入每個受影響實體的 Stream
	 * 3. 將整批事件寫入聚合根 Stream
	 * </pre>
	 *
	 * @throws NoActiveTransactionException 尚未呼叫 beginTransaction
	 */
	public void commitTransaction(String aggregateId) {
		PendingTransaction tx = transactions.remove(aggregateId);
		if (tx == null) {
			throw new NoActiveTransactionException(aggregateId);
		}
		if (tx.isEmpty()) {
			log.debug("[Tx] 聚合根 {} 的交易沒有待提交事件，直接結束", aggregateId);
			return;
		}

		int appends = 0;
		try {
			for (PendingEvent pending : tx.getEvents()) {
				for (EntityReference ref : pending.getAffectedEntities()) {
					String entityStream = naming.entityStream(ref.getType(), ref.getId());
					eventLog.appendToStream(entityStream, List.of(pending.getEvent()), ExpectedStreamRevision.any());
					appends++;
				}
			}

			List<VersionedEvent> batch = new ArrayList<>();
			tx.getEvents().forEach(pending -> batch.add(pending.getEvent()));
			eventLog.appendToStream(naming.aggregateStream(aggregateId), batch, tx.getExpectedRevision());
			appends++;

			log.info("[Tx] 聚合根 {} -> {}：{} 筆事件，共 {} 次寫入", aggregateId, TransactionState.COMMITTED,
					batch.size(), appends);
		} catch (RuntimeException e) {
			log.error("[Tx] 聚合根 {} 提交失敗，已完成的 {} 次寫入不會撤回: {}", aggregateId, appends, e.getMessage());
			throw e;
		}
	}

	/**
	 * 捨棄進行中的交易，不寫入任何資料
	 */
	public void rollbackTransaction(String aggregateId) {
		PendingTransaction tx = transactions.remove(aggregateId);
		if (tx != null) {
			log.warn("[Tx] 聚合根 {} -> {}：捨棄 {} 筆待提交事件", aggregateId, TransactionState.ROLLED_BACK,
					tx.getEvents().size());
		}
	}

	public boolean isTransactionOpen(String aggregateId) {
		return transactions.containsKey(aggregateId);
	}

	public TransactionState getTransactionState(String aggregateId) {
		return isTransactionOpen(aggregateId) ? TransactionState.OPEN : TransactionState.NO_TRANSACTION;
	}

	/**
	 * 進行中交易記錄的實體 Stream 聲稱版本
	 */
	public Map<String, Long> pendingEntityVersions(String aggregateId) {
		PendingTransaction tx = transactions.get(aggregateId);
		return tx != null ? Map.copyOf(tx.getEntityVersions()) : Map.of();
	}

	private void open(String aggregateId, ExpectedStreamRevision expectedRevision) {
		PendingTransaction previous = transactions.put(aggregateId,
				new PendingTransaction(aggregateId, expectedRevision));
		if (previous != null && !previous.isEmpty()) {
			log.warn("[Tx] 聚合根 {} 重新開始交易，先前 {} 筆待提交事件已清空", aggregateId, previous.getEvents().size());
		}
		log.debug("[Tx] 聚合根 {} -> {} (expected={})", aggregateId, TransactionState.OPEN, expectedRevision);
	}

	private VersionedEvent withAffectedEntities(VersionedEvent event, List<EntityReference> refs) {
		if (refs.isEmpty()) {
			return event;
		}
		ObjectNode metadata = event.getMetadata() != null ? event.getMetadata().deepCopy()
				: JsonNodeFactory.instance.objectNode();
		ArrayNode entities = metadata.putArray(AFFECTED_ENTITIES_KEY);
		for (EntityReference ref : refs) {
			entities.addObject().put("id", ref.getId()).put("type", ref.getType()).put("version", ref.getVersion());
		}
		return event.toBuilder().metadata(metadata).build();
	}
}
