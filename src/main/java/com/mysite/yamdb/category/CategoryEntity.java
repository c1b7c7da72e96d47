package com.mysite.yamdb.category;

import com.mysite.yamdb.title.TitleEntity;
import jakarta.persistence.*;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

import java.util.ArrayList;
import java.util.List;

@Entity
@Getter
@Setter
@NoArgsConstructor
@Table(name = "category")
public class CategoryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, length = 256)
    private String name;

    @Column(nullable = false, unique = true, length = 50)
    private String slug;

    // 카테고리 삭제 시 소속 작품까지 함께 삭제된다
    @OneToMany(mappedBy = "category", cascade = CascadeType.REMOVE)
    private List<TitleEntity> titles = new ArrayList<>();

    public CategoryEntity(String name, String slug) {
        this.name = name;
        this.slug = slug;
    }
}
