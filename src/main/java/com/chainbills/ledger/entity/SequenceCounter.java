package com.chainbills.ledger.entity;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import javax.persistence.*;

/**
 * Last value handed out for one (scope, scope id) pair.
 */
@Entity
@Table(
        name = "sequence_counters",
        uniqueConstraints = @UniqueConstraint(name = "uq_counter_scope", columnNames = {"scope", "scope_id"})
)
@Getter
@Setter
@NoArgsConstructor
public class SequenceCounter {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "scope", nullable = false, length = 40)
    private CounterScope scope;

    @Column(name = "scope_id", nullable = false, length = 140)
    private String scopeId;

    @Column(name = "current_value", nullable = false)
    private long value;

    public SequenceCounter(CounterScope scope, String scopeId) {
        this.scope = scope;
        this.scopeId = scopeId;
    }
}
