package com.mysite.yamdb.title;

import com.mysite.yamdb.category.CategoryEntity;
import com.mysite.yamdb.genre.GenreEntity;
import com.mysite.yamdb.review.ReviewEntity;
import com.mysite.yamdb.title.validation.NotFutureYear;
import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.BatchSize;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "title")
public class TitleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 256)
    private String name;

    // 저장 시점에도 미래 연도를 막는다 (Bean Validation pre-persist / pre-update)
    @NotNull
    @NotFutureYear
    @Column(name = "release_year", nullable = false)
    private Integer year;

    @Column(columnDefinition = "TEXT")
    private String description;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "category_id", nullable = false)
    private CategoryEntity category;

    @BatchSize(size = 50)
    @OneToMany(mappedBy = "title", cascade = CascadeType.ALL, orphanRemoval = true)
    private List<GenreTitleEntity> genreTitles = new ArrayList<>();

    // 작품 삭제 → 리뷰 삭제 → 댓글 삭제로 이어진다
    @OneToMany(mappedBy = "title", cascade = CascadeType.REMOVE)
    private List<ReviewEntity> reviews = new ArrayList<>();

    public TitleEntity(String name, Integer year, String description, CategoryEntity category) {
        this.name = name;
        this.year = year;
        this.description = description;
        this.category = category;
    }

    public List<GenreEntity> getGenres() {
        return genreTitles.stream()
                .map(GenreTitleEntity::getGenre)
                .toList();
    }

    /**
     * 장르 목록 전체 교체. 연결 레코드는 orphanRemoval 로 정리된다.
     */
    public void replaceGenres(Collection<GenreEntity> genres) {
        genreTitles.clear();
        for (GenreEntity genre : genres) {
            genreTitles.add(new GenreTitleEntity(genre, this));
        }
    }
}
