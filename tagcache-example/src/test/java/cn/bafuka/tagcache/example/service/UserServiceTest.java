package cn.bafuka.tagcache.example.service;

import cn.bafuka.tagcache.autoconfigure.TagCacheAutoConfiguration;
import cn.bafuka.tagcache.example.entity.User;
import cn.bafuka.tagcache.example.repository.InMemoryUserRepository;
import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import java.util.List;

import static org.junit.Assert.*;

/**
 * UserService 集成测试
 * 经过真实的切面，验证写操作后各个读路径不会返回旧数据
 */
public class UserServiceTest {

    private AnnotationConfigApplicationContext context;

    private UserService userService;

    @Before
    public void setUp() {
        context = new AnnotationConfigApplicationContext();
        context.register(TagCacheAutoConfiguration.class, InMemoryUserRepository.class, UserService.class);
        context.refresh();
        userService = context.getBean(UserService.class);
    }

    @After
    public void tearDown() {
        context.close();
    }

    /**
     * 测试创建用户后全量列表立即可见
     */
    @Test
    public void testCreateThenList() {
        userService.createUser(newUser("alice", "dev"));
        assertEquals(1, userService.getAllUsers().size());

        // 执行
        userService.createUser(newUser("bob", "dev"));

        // 验证
        List<User> users = userService.getAllUsers();
        assertEquals(2, users.size());
        assertEquals("bob", users.get(1).getUsername());
    }

    /**
     * 测试更新用户后全量列表和单个用户都是新值
     */
    @Test
    public void testUpdateThenRead() {
        User alice = userService.createUser(newUser("alice", "dev"));
        assertEquals("alice", userService.getUserById(alice.getId()).getUsername());
        assertEquals("alice", userService.getAllUsers().get(0).getUsername());

        // 执行
        User renamed = newUser("alice2", "dev");
        renamed.setId(alice.getId());
        userService.updateUser(renamed);

        // 验证
        assertEquals("alice2", userService.getUserById(alice.getId()).getUsername());
        assertEquals("alice2", userService.getAllUsers().get(0).getUsername());
    }

    /**
     * 测试调岗后原部门和新部门的成员列表都被刷新
     */
    @Test
    public void testMoveDepartment() {
        User alice = userService.createUser(newUser("alice", "dev"));
        userService.createUser(newUser("bob", "dev"));
        assertEquals(2, userService.getUsersByDepartment("dev").size());
        assertTrue(userService.getUsersByDepartment("ops").isEmpty());

        // 执行
        User moved = newUser("alice", "ops");
        moved.setId(alice.getId());
        userService.updateUser(moved);

        // 验证
        assertEquals(1, userService.getUsersByDepartment("dev").size());
        assertEquals("bob", userService.getUsersByDepartment("dev").get(0).getUsername());
        assertEquals(1, userService.getUsersByDepartment("ops").size());
    }

    /**
     * 测试删除用户后所有读路径都看不到该用户
     */
    @Test
    public void testDeleteThenRead() {
        User alice = userService.createUser(newUser("alice", "dev"));
        assertNotNull(userService.getUserById(alice.getId()));
        assertEquals(1, userService.getAllUsers().size());

        // 执行
        userService.deleteUser(alice.getId());

        // 验证
        assertNull(userService.getUserById(alice.getId()));
        assertTrue(userService.getAllUsers().isEmpty());
        assertTrue(userService.getUsersByDepartment("dev").isEmpty());
    }

    private static User newUser(String username, String department) {
        User user = new User();
        user.setUsername(username);
        user.setEmail(username + "@example.com");
        user.setDepartment(department);
        return user;
    }
}
