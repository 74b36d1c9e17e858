package org.devops.customers.domain;

import io.hypersistence.tsid.TSID;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Entity
@Table(name = "customers")
@Getter
@Setter
@NoArgsConstructor
public class CustomerEntity {

  @Id
  @JdbcTypeCode(SqlTypes.BIGINT)
  @Column(name = "id", updatable = false, nullable = false)
  private Long id;

  @Column(name = "name", length = 64, nullable = false)
  private String name;

  @Column(name = "address", length = 256, nullable = false)
  private String address;

  @Column(name = "email", length = 128, nullable = false)
  private String email;

  @Column(name = "phone_number", length = 32, nullable = false)
  private String phoneNumber;

  @Column(name = "member_since", nullable = false)
  private LocalDate memberSince;

  @Column(name = "status", length = 32, nullable = false)
  private String status;

  @Column(name = "created_at", updatable = false)
  private Instant createdAt;

  @Column(name = "updated_at")
  private Instant updatedAt;

  @PrePersist
  void prePersist() {
    if (id == null) {
      id = TSID.Factory.getTsid().toLong();
    }
    createdAt = Instant.now();
    updatedAt = createdAt;
  }

  @PreUpdate
  void preUpdate() {
    updatedAt = Instant.now();
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof CustomerEntity that)) return false;
    return id != null && Objects.equals(id, that.id);
  }

  @Override
  public int hashCode() {
    return getClass().hashCode();
  }

  @Override
  public String toString() {
    return "CustomerEntity{"
        + "id="
        + id
        + ", name='"
        + name
        + '\''
        + ", status='"
        + status
        + '\''
        + ", memberSince="
        + memberSince
        + ", updatedAt="
        + updatedAt
        + '}';
  }
}
