package cn.bafuka.tagcache.example.entity;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 用户实体
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class User {

    private Long id;

    private String username;

    private String email;

    /**
     * 所属部门，用于演示按部门失效
     */
    private String department;

    private LocalDateTime createTime;

    private LocalDateTime updateTime;
}
