package com.mysite.yamdb.title;

import com.mysite.yamdb.genre.GenreEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * 작품 ↔ 장르 연결 레코드 (N:M 중간 테이블)
 */
@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "genre_title")
public class GenreTitleEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "genre_id", nullable = false)
    private GenreEntity genre;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "title_id", nullable = false)
    private TitleEntity title;

    public GenreTitleEntity(GenreEntity genre, TitleEntity title) {
        this.genre = genre;
        this.title = title;
    }
}
