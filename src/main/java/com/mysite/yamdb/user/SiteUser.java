package com.mysite.yamdb.user;

import com.mysite.yamdb.comment.CommentEntity;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.user.Role.Role;
import jakarta.persistence.*;
import lombok.Builder;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.io.Serial;
import java.io.Serializable;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Getter
@Setter
@Entity
@Table(name = "site_user")
public class SiteUser implements Serializable {

    @Serial
    private static final long serialVersionUID = 1L;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 150)
    private String username;

    @Column(nullable = false, unique = true, length = 254)
    private String email;

    @Column(length = 150)
    private String firstName;

    @Column(length = 150)
    private String lastName;

    @Column(columnDefinition = "TEXT")
    private String bio;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private Role role = Role.USER;

    // 관리 화면 접근 권한 (admin 등급과 별개로 부여될 수 있음)
    @Column(nullable = false)
    private boolean staff = false;

    // API 가입 사용자는 비밀번호 없이 확인 코드로만 토큰을 받는다
    @Column
    private String password;

    @Column(length = 12)
    private String confirmationCode;

    @CreationTimestamp
    private LocalDateTime dateJoined;

    @OneToMany(mappedBy = "author", cascade = CascadeType.REMOVE)
    private List<ReviewEntity> reviews = new ArrayList<>();

    @OneToMany(mappedBy = "author", cascade = CascadeType.REMOVE)
    private List<CommentEntity> comments = new ArrayList<>();

    @Builder
    public SiteUser(String username, String email, String firstName, String lastName, String bio,
                    Role role, boolean staff, String password, String confirmationCode) {
        this.username = username;
        this.email = email;
        this.firstName = firstName;
        this.lastName = lastName;
        this.bio = bio;
        this.role = role == null ? Role.USER : role;
        this.staff = staff;
        this.password = password;
        this.confirmationCode = confirmationCode;
    }

    public SiteUser() {
    }

    public boolean isAdmin() {
        return role == Role.ADMIN;
    }

    public boolean isModerator() {
        return role == Role.MODERATOR;
    }
}
