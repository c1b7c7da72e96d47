package com.mysite.yamdb.review;

import com.mysite.yamdb.comment.CommentEntity;
import com.mysite.yamdb.permission.Authored;
import com.mysite.yamdb.title.TitleEntity;
import com.mysite.yamdb.user.SiteUser;
import jakarta.persistence.*;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@Table(
        name = "review",
        // 한 사용자는 한 작품에 리뷰를 하나만 남길 수 있다 (DB 레벨 최종 보증)
        uniqueConstraints = @UniqueConstraint(name = "unique_review_author", columnNames = {"author_id", "title_id"})
)
public class ReviewEntity implements Authored {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "title_id", nullable = false)
    private TitleEntity title;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false)
    private SiteUser author;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Min(0)
    @Max(10)
    @Column(nullable = false)
    private Integer score;

    @Column(name = "pub_date", updatable = false, nullable = false)
    @CreationTimestamp
    private LocalDateTime pubDate;

    @OneToMany(mappedBy = "review", cascade = CascadeType.REMOVE)
    private List<CommentEntity> comments = new ArrayList<>();
}
