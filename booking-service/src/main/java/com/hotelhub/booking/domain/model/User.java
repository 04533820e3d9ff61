package com.hotelhub.booking.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Guest or staff account as seen by the booking engine. Only the role and the loyalty balance matter here;
 * credentials live with the authentication service.
 */
@Entity
@Table(name = "users")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class User {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "username", nullable = false, unique = true, length = 100)
    private String username;

    @Column(name = "email", nullable = false, unique = true)
    private String email;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(name = "role", nullable = false, length = 20)
    private UserRole role = UserRole.USER;

    @Builder.Default
    @Column(name = "bonus_points", nullable = false)
    private Integer bonusPoints = 0;

    @Builder.Default
    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    public void addBonusPoints(int points) {
        if (points < 0) {
            throw new IllegalArgumentException("Bonus points cannot be negative: " + points);
        }
        this.bonusPoints += points;
    }
}
