package com.mysite.yamdb.comment;

import com.mysite.yamdb.permission.Authored;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.user.SiteUser;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

@Entity
@Getter
@Setter
@Table(name = "review_comment")
public class CommentEntity implements Authored {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // 어떤 리뷰에 달린 댓글인지 (N:1)
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "review_id", nullable = false)
    private ReviewEntity review;

    // 누가 작성했는지 (N:1)
    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "author_id", nullable = false)
    private SiteUser author;

    @Column(columnDefinition = "TEXT", nullable = false)
    private String text;

    @Column(name = "pub_date", updatable = false, nullable = false)
    @CreationTimestamp
    private LocalDateTime pubDate;
}
